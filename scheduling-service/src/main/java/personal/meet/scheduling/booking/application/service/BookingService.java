package personal.meet.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.application.port.in.CancelBookingUseCase;
import personal.meet.scheduling.booking.application.port.in.CreateBookingCommand;
import personal.meet.scheduling.booking.application.port.in.CreateBookingUseCase;
import personal.meet.scheduling.booking.application.port.in.GetBookingsUseCase;
import personal.meet.scheduling.booking.application.port.in.RescheduleBookingCommand;
import personal.meet.scheduling.booking.application.port.in.RescheduleBookingUseCase;
import personal.meet.scheduling.booking.application.port.out.BookingRepository;
import personal.meet.scheduling.booking.application.port.out.NotificationPublisher;
import personal.meet.scheduling.booking.domain.exception.BookingNotFoundException;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.TimeInterval;
import personal.meet.scheduling.booking.domain.service.BookingConfirmationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Booking Service
 * 호스트 측 예약 관리 (직접 생성, 취소, 일정 변경, 조회)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements CreateBookingUseCase, CancelBookingUseCase, RescheduleBookingUseCase,
        GetBookingsUseCase {

    private final BookingRepository bookingRepository;
    private final BookingConfirmationManager bookingConfirmationManager;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    @Override
    public Booking createBooking(CreateBookingCommand command) {
        Booking booking = Booking.confirmed(
                command.hostId(),
                new TimeInterval(command.startTime(), command.endTime()),
                command.customer(),
                clock.instant());

        Booking saved = bookingConfirmationManager.createInTransaction(booking);
        publish(saved, true);
        return saved;
    }

    @Override
    public Booking cancelBooking(Long hostId, Long bookingId) {
        loadOwnedBooking(hostId, bookingId);

        Booking cancelled = bookingConfirmationManager.cancelBookingInTransaction(hostId, bookingId);

        publish(cancelled, false);
        return cancelled;
    }

    @Override
    public Booking rescheduleBooking(RescheduleBookingCommand command) {
        return bookingConfirmationManager.rescheduleInTransaction(
                command.hostId(), command.bookingId(), command.interval());
    }

    @Override
    public List<Booking> listBookings(Long hostId, Instant from, Instant to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Range end must be after start: from=%s, to=%s", from, to));
        }
        List<Booking> bookings = bookingRepository.findByHostBetween(hostId, from, to).stream()
                .sorted(Comparator.comparing(Booking::startTime))
                .toList();
        log.debug("Bookings listed: hostId={}, from={}, to={}, count={}", hostId, from, to, bookings.size());
        return bookings;
    }

    @Override
    public Booking getBooking(Long hostId, Long bookingId) {
        return loadOwnedBooking(hostId, bookingId);
    }

    private Booking loadOwnedBooking(Long hostId, Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> {
                    log.warn("Booking not found: bookingId={}", bookingId);
                    return new BookingNotFoundException(bookingId);
                });
        booking.ensureOwnedBy(hostId);
        return booking;
    }

    private void publish(Booking booking, boolean confirmed) {
        try {
            if (confirmed) {
                notificationPublisher.bookingConfirmed(booking);
            } else {
                notificationPublisher.bookingCancelled(booking);
            }
        } catch (Exception e) {
            log.error("Failed to publish booking event: bookingId={}, status={}",
                    booking.id(), booking.status(), e);
        }
    }
}
