package personal.meet.scheduling.booking.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

/**
 * Booking Request Not Found Exception
 * 알 수 없는 요청 ID 또는 확정 토큰
 */
public class BookingRequestNotFoundException extends BusinessException {
    public BookingRequestNotFoundException(Long requestId) {
        super(ErrorCode.BOOKING_REQUEST_NOT_FOUND,
                String.format("Booking request not found: requestId=%d", requestId));
    }

    public BookingRequestNotFoundException() {
        super(ErrorCode.BOOKING_REQUEST_NOT_FOUND, "Booking request not found for confirmation token");
    }
}
