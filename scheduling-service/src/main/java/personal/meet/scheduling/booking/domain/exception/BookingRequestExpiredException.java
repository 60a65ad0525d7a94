package personal.meet.scheduling.booking.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

import java.time.Instant;

/**
 * Booking Request Expired Exception
 * 만료 시각 이후 확정을 시도한 경우
 */
public class BookingRequestExpiredException extends BusinessException {
    public BookingRequestExpiredException(Long requestId, Instant expiresAt) {
        super(ErrorCode.BOOKING_REQUEST_EXPIRED,
                String.format("Booking request has expired: requestId=%d, expiresAt=%s", requestId, expiresAt));
    }
}
