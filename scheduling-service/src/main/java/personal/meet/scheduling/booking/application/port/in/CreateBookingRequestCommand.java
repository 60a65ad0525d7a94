package personal.meet.scheduling.booking.application.port.in;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;
import personal.meet.scheduling.booking.domain.model.TimeInterval;

/**
 * Create Booking Request Command
 * 고객이 선택한 슬롯에 대한 예약 요청
 */
public record CreateBookingRequestCommand(
        Long hostId,
        TimeInterval slot,
        CustomerInfo customer
) {
    public CreateBookingRequestCommand {
        if (hostId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host ID cannot be null");
        }
        if (slot == null || slot.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TIME, "Requested slot cannot be empty");
        }
        if (customer == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer cannot be null");
        }
    }
}
