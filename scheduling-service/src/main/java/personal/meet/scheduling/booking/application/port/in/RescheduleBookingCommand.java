package personal.meet.scheduling.booking.application.port.in;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.time.Instant;

/**
 * Reschedule Booking Command
 */
public record RescheduleBookingCommand(
        Long hostId,
        Long bookingId,
        Instant startTime,
        Instant endTime
) {
    public RescheduleBookingCommand {
        if (hostId == null || bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host ID and booking ID cannot be null");
        }
        if (startTime == null || endTime == null || !startTime.isBefore(endTime)) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TIME,
                    String.format("Booking end must be after start: start=%s, end=%s", startTime, endTime));
        }
    }

    public TimeInterval interval() {
        return new TimeInterval(startTime, endTime);
    }
}
