package personal.meet.scheduling.availability.application.port.in;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

import java.time.LocalTime;

/**
 * Update Availability Rule Command
 * null 필드는 변경하지 않는다. maxBookingsPerDay 제한을 없애려면 clearMaxBookingsPerDay를 사용한다.
 */
public record UpdateAvailabilityRuleCommand(
        Long hostId,
        Long ruleId,
        Integer dayOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        Integer bufferMinutes,
        Integer maxBookingsPerDay,
        boolean clearMaxBookingsPerDay
) {
    public UpdateAvailabilityRuleCommand {
        if (hostId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host ID cannot be null");
        }
        if (ruleId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Rule ID cannot be null");
        }
        if (clearMaxBookingsPerDay && maxBookingsPerDay != null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Cannot set and clear max bookings per day at the same time");
        }
    }
}
