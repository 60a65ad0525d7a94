package personal.meet.scheduling.booking.adapter.out.persistence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import personal.meet.scheduling.booking.application.port.out.BookingRepository;
import personal.meet.scheduling.booking.domain.exception.SlotConflictException;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingStatus;
import personal.meet.scheduling.host.domain.exception.HostNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 *
 * <p>runAtomic: 짧은 READ_COMMITTED 트랜잭션 + 호스트 행 SELECT ... FOR UPDATE.
 * 잠금을 얻은 뒤의 겹침 조회는 먼저 커밋된 예약을 반드시 본다.
 */
@Slf4j
@Component
public class BookingPersistenceAdapter implements BookingRepository {

    private final JpaBookingRepository jpaBookingRepository;
    private final TransactionTemplate transactionTemplate;

    public BookingPersistenceAdapter(JpaBookingRepository jpaBookingRepository,
                                     PlatformTransactionManager transactionManager) {
        this.jpaBookingRepository = jpaBookingRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    @Override
    public List<Booking> findConfirmedByHostBetween(Long hostId, Instant from, Instant to) {
        log.debug("Finding confirmed bookings: hostId={}, from={}, to={}", hostId, from, to);
        return jpaBookingRepository.findOverlapping(hostId, BookingStatus.CONFIRMED, from, to).stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public List<Booking> findByHostBetween(Long hostId, Instant from, Instant to) {
        return jpaBookingRepository
                .findByHostIdAndStartTimeGreaterThanEqualAndStartTimeLessThanOrderByStartTimeAsc(hostId, from, to)
                .stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<Booking> findById(Long bookingId) {
        log.debug("Finding booking: bookingId={}", bookingId);
        return jpaBookingRepository.findById(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Booking insertConfirmed(Booking booking) {
        try {
            return jpaBookingRepository.saveAndFlush(BookingEntity.fromDomain(booking)).toDomain();
        } catch (DataIntegrityViolationException e) {
            log.warn("Booking insert rejected by constraint: hostId={}, start={}",
                    booking.hostId(), booking.startTime());
            throw new SlotConflictException(booking.hostId(), booking.interval(), e);
        }
    }

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking: bookingId={}, status={}", booking.id(), booking.status());
        return jpaBookingRepository.save(BookingEntity.fromDomain(booking)).toDomain();
    }

    @Override
    public <T> T runAtomic(Long hostId, Supplier<T> work) {
        return transactionTemplate.execute(status -> {
            jpaBookingRepository.lockHostRow(hostId)
                    .orElseThrow(() -> new HostNotFoundException(hostId));
            log.debug("Host row locked: hostId={}", hostId);
            return work.get();
        });
    }
}
