package personal.meet.scheduling.booking.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.domain.model.BookingRequestStatus;

/**
 * Invalid Booking Request State Exception
 * PENDING이 아닌 요청에 대한 전이 시도. 이미 확정된 요청의 재확정도 여기에 해당한다.
 */
public class InvalidBookingRequestStateException extends BusinessException {
    public InvalidBookingRequestStateException(Long requestId, BookingRequestStatus currentStatus) {
        super(ErrorCode.INVALID_BOOKING_REQUEST_STATE,
                String.format("예약 요청이 PENDING 상태가 아닙니다. requestId=%d, 현재 상태: %s",
                        requestId, currentStatus));
    }
}
