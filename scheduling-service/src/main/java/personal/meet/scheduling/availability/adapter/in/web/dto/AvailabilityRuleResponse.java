package personal.meet.scheduling.availability.adapter.in.web.dto;

import personal.meet.scheduling.availability.domain.model.AvailabilityRule;

import java.time.LocalTime;

/**
 * 가용 시간 규칙 응답 DTO
 */
public record AvailabilityRuleResponse(
        Long ruleId,
        Long hostId,
        int dayOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        int bufferMinutes,
        Integer maxBookingsPerDay
) {
    public static AvailabilityRuleResponse from(AvailabilityRule rule) {
        return new AvailabilityRuleResponse(
                rule.id(),
                rule.hostId(),
                rule.dayOfWeek(),
                rule.startTime(),
                rule.endTime(),
                rule.bufferMinutes(),
                rule.maxBookingsPerDay()
        );
    }
}
