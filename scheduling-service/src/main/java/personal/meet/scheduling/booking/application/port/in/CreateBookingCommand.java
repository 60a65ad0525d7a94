package personal.meet.scheduling.booking.application.port.in;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;

import java.time.Instant;

/**
 * Create Booking Command
 * 호스트가 직접 생성하는 확정 예약
 */
public record CreateBookingCommand(
        Long hostId,
        Instant startTime,
        Instant endTime,
        CustomerInfo customer
) {
    public CreateBookingCommand {
        if (hostId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host ID cannot be null");
        }
        if (startTime == null || endTime == null || !startTime.isBefore(endTime)) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TIME,
                    String.format("Booking end must be after start: start=%s, end=%s", startTime, endTime));
        }
        if (customer == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer cannot be null");
        }
    }
}
