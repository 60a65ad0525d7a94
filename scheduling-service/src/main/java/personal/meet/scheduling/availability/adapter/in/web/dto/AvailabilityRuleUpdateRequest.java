package personal.meet.scheduling.availability.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import personal.meet.scheduling.availability.application.port.in.UpdateAvailabilityRuleCommand;

import java.time.LocalTime;

/**
 * 가용 시간 규칙 부분 수정 요청 DTO
 * 생략한 필드는 기존 값 유지
 */
public record AvailabilityRuleUpdateRequest(
        @Min(value = 0, message = "요일은 0(일요일)부터 6(토요일)까지입니다.")
        @Max(value = 6, message = "요일은 0(일요일)부터 6(토요일)까지입니다.")
        Integer dayOfWeek,

        LocalTime startTime,

        LocalTime endTime,

        @Min(value = 0, message = "버퍼는 0분 이상이어야 합니다.")
        Integer bufferMinutes,

        @Positive(message = "하루 최대 예약 수는 양수여야 합니다.")
        Integer maxBookingsPerDay,

        Boolean clearMaxBookingsPerDay
) {
    public UpdateAvailabilityRuleCommand toCommand(Long hostId, Long ruleId) {
        return new UpdateAvailabilityRuleCommand(hostId, ruleId, dayOfWeek, startTime, endTime,
                bufferMinutes, maxBookingsPerDay, Boolean.TRUE.equals(clearMaxBookingsPerDay));
    }
}
