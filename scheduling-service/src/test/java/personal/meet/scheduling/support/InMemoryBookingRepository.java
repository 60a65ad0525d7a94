package personal.meet.scheduling.support;

import personal.meet.scheduling.booking.application.port.out.BookingRepository;
import personal.meet.scheduling.booking.domain.exception.SlotConflictException;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingStatus;
import personal.meet.scheduling.host.domain.exception.HostNotFoundException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 호스트별 락으로 runAtomic을 직렬화하는 테스트용 저장소.
 * 확정 흐름은 모든 검사가 끝난 뒤에만 쓰므로 롤백은 흉내내지 않는다.
 */
public class InMemoryBookingRepository implements BookingRepository {

    private final Map<Long, Booking> bookings = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> hostLocks = new ConcurrentHashMap<>();
    private final Set<Long> hosts = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryBookingRepository(Long... hostIds) {
        hosts.addAll(List.of(hostIds));
    }

    @Override
    public List<Booking> findConfirmedByHostBetween(Long hostId, Instant from, Instant to) {
        return bookings.values().stream()
                .filter(b -> b.hostId().equals(hostId) && b.status() == BookingStatus.CONFIRMED)
                .filter(b -> b.startTime().isBefore(to) && b.endTime().isAfter(from))
                .sorted(Comparator.comparing(Booking::startTime))
                .toList();
    }

    @Override
    public List<Booking> findByHostBetween(Long hostId, Instant from, Instant to) {
        return bookings.values().stream()
                .filter(b -> b.hostId().equals(hostId))
                .filter(b -> !b.startTime().isBefore(from) && b.startTime().isBefore(to))
                .toList();
    }

    @Override
    public Optional<Booking> findById(Long bookingId) {
        return Optional.ofNullable(bookings.get(bookingId));
    }

    @Override
    public Booking insertConfirmed(Booking booking) {
        if (booking.bookingRequestId() != null && bookings.values().stream()
                .anyMatch(b -> booking.bookingRequestId().equals(b.bookingRequestId()))) {
            throw new SlotConflictException(booking.hostId(), booking.interval());
        }
        return save(booking);
    }

    @Override
    public Booking save(Booking booking) {
        Long id = booking.id() != null ? booking.id() : sequence.incrementAndGet();
        Booking stored = new Booking(id, booking.hostId(), booking.startTime(), booking.endTime(),
                booking.status(), booking.customer(), booking.bookingRequestId(), booking.createdAt());
        bookings.put(id, stored);
        return stored;
    }

    @Override
    public <T> T runAtomic(Long hostId, Supplier<T> work) {
        if (!hosts.contains(hostId)) {
            throw new HostNotFoundException(hostId);
        }
        ReentrantLock lock = hostLocks.computeIfAbsent(hostId, id -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public List<Booking> confirmedBookings(Long hostId) {
        return findConfirmedByHostBetween(hostId, Instant.MIN, Instant.MAX);
    }
}
