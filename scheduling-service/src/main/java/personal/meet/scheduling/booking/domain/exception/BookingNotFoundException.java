package personal.meet.scheduling.booking.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

/**
 * Booking Not Found Exception
 */
public class BookingNotFoundException extends BusinessException {
    public BookingNotFoundException(Long bookingId) {
        super(ErrorCode.BOOKING_NOT_FOUND, String.format("Booking not found: bookingId=%d", bookingId));
    }
}
