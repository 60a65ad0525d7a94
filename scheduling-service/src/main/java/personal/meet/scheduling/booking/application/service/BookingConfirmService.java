package personal.meet.scheduling.booking.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.meet.scheduling.booking.application.port.in.ConfirmBookingRequestUseCase;
import personal.meet.scheduling.booking.application.port.out.BookingRequestRepository;
import personal.meet.scheduling.booking.application.port.out.ConfirmationLockRepository;
import personal.meet.scheduling.booking.application.port.out.NotificationPublisher;
import personal.meet.scheduling.booking.domain.exception.BookingRequestExpiredException;
import personal.meet.scheduling.booking.domain.exception.BookingRequestNotFoundException;
import personal.meet.scheduling.booking.domain.exception.ConfirmationInProgressException;
import personal.meet.scheduling.booking.domain.exception.SlotConflictException;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingRequest;
import personal.meet.scheduling.booking.domain.service.BookingConfirmationManager;
import personal.meet.scheduling.config.SchedulingProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Booking Confirm Service (SRP)
 * 단일 책임: 예약 요청 확정
 *
 * <p>Redis 선점은 같은 요청의 중복 확정을 빠르게 거절하는 1차 방어선이고,
 * 이중 예약 방지는 BookingConfirmationManager의 원자적 작업 단위가 보장한다.
 */
@Slf4j
@Service
public class BookingConfirmService implements ConfirmBookingRequestUseCase {

    private final BookingRequestRepository bookingRequestRepository;
    private final ConfirmationLockRepository confirmationLockRepository;
    private final BookingConfirmationManager bookingConfirmationManager;
    private final NotificationPublisher notificationPublisher;
    private final SchedulingProperties properties;
    private final Clock clock;
    private final Counter lostRaceCounter;

    public BookingConfirmService(BookingRequestRepository bookingRequestRepository,
                                 ConfirmationLockRepository confirmationLockRepository,
                                 BookingConfirmationManager bookingConfirmationManager,
                                 NotificationPublisher notificationPublisher,
                                 SchedulingProperties properties,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.bookingRequestRepository = bookingRequestRepository;
        this.confirmationLockRepository = confirmationLockRepository;
        this.bookingConfirmationManager = bookingConfirmationManager;
        this.notificationPublisher = notificationPublisher;
        this.properties = properties;
        this.clock = clock;
        this.lostRaceCounter = Counter.builder("scheduling.confirmations.lost_race")
                .description("Booking request confirmations rejected by a concurrent booking")
                .register(meterRegistry);
    }

    @Override
    public Booking confirmRequest(String confirmationToken) {
        Instant now = clock.instant();

        BookingRequest request = bookingRequestRepository.findByToken(confirmationToken)
                .orElseThrow(() -> {
                    log.warn("Booking request not found for confirmation");
                    return new BookingRequestNotFoundException();
                });

        request.ensurePending();

        if (request.isExpiredAt(now)) {
            bookingConfirmationManager.expireIfPending(request.hostId(), request.id());
            log.info("Booking request expired on confirm: requestId={}, expiresAt={}",
                    request.id(), request.expiresAt());
            throw new BookingRequestExpiredException(request.id(), request.expiresAt());
        }

        String owner = UUID.randomUUID().toString();
        boolean locked = confirmationLockRepository.tryLock(
                confirmationToken, owner, properties.request().confirmationLockTtl());
        if (!locked) {
            log.warn("Confirmation already in progress: requestId={}", request.id());
            throw new ConfirmationInProgressException(request.id());
        }

        try {
            Booking booking;
            try {
                booking = bookingConfirmationManager.confirmInTransaction(request.hostId(), request.id(), now);
            } catch (SlotConflictException e) {
                bookingConfirmationManager.expireIfPending(request.hostId(), request.id());
                lostRaceCounter.increment();
                log.warn("Booking request lost confirmation race: requestId={}, hostId={}",
                        request.id(), request.hostId());
                throw e;
            }

            publishConfirmed(booking);
            return booking;

        } finally {
            confirmationLockRepository.unlock(confirmationToken, owner);
        }
    }

    /**
     * 커밋 이후 발행. 실패해도 확정은 유지된다.
     */
    private void publishConfirmed(Booking booking) {
        try {
            notificationPublisher.bookingConfirmed(booking);
        } catch (Exception e) {
            log.error("Failed to publish booking confirmed event: bookingId={}", booking.id(), e);
        }
    }
}
