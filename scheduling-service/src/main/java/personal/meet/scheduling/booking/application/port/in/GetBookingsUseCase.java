package personal.meet.scheduling.booking.application.port.in;

import personal.meet.scheduling.booking.domain.model.Booking;

import java.time.Instant;
import java.util.List;

/**
 * Get Bookings UseCase (Input Port)
 */
public interface GetBookingsUseCase {

    /**
     * [from, to) 안에서 시작하는 예약 (확정, 취소 모두), 시작 시각 순
     */
    List<Booking> listBookings(Long hostId, Instant from, Instant to);

    Booking getBooking(Long hostId, Long bookingId);
}
