package personal.meet.scheduling.booking.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.domain.model.BookingStatus;

/**
 * Invalid Booking State Exception
 * 취소된 예약을 다시 취소하거나 일정 변경하려는 경우
 */
public class InvalidBookingStateException extends BusinessException {
    public InvalidBookingStateException(Long bookingId, BookingStatus currentStatus) {
        super(ErrorCode.INVALID_BOOKING_STATE,
                String.format("예약이 CONFIRMED 상태가 아닙니다. bookingId=%d, 현재 상태: %s",
                        bookingId, currentStatus));
    }
}
