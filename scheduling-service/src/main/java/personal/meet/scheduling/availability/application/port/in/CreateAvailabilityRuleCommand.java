package personal.meet.scheduling.availability.application.port.in;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

import java.time.LocalTime;

/**
 * Create Availability Rule Command
 */
public record CreateAvailabilityRuleCommand(
        Long hostId,
        Integer dayOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        Integer bufferMinutes,
        Integer maxBookingsPerDay
) {
    public CreateAvailabilityRuleCommand {
        if (hostId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host ID cannot be null");
        }
        if (dayOfWeek == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Day of week cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start and end time cannot be null");
        }
        if (bufferMinutes == null) {
            bufferMinutes = 0;
        }
    }
}
