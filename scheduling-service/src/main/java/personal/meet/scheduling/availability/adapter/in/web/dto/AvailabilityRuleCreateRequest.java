package personal.meet.scheduling.availability.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import personal.meet.scheduling.availability.application.port.in.CreateAvailabilityRuleCommand;

import java.time.LocalTime;

/**
 * 가용 시간 규칙 생성 요청 DTO
 */
public record AvailabilityRuleCreateRequest(
        @NotNull(message = "요일은 필수입니다.")
        @Min(value = 0, message = "요일은 0(일요일)부터 6(토요일)까지입니다.")
        @Max(value = 6, message = "요일은 0(일요일)부터 6(토요일)까지입니다.")
        Integer dayOfWeek,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalTime startTime,

        @NotNull(message = "종료 시각은 필수입니다.")
        LocalTime endTime,

        @Min(value = 0, message = "버퍼는 0분 이상이어야 합니다.")
        Integer bufferMinutes,

        @Positive(message = "하루 최대 예약 수는 양수여야 합니다.")
        Integer maxBookingsPerDay
) {
    public CreateAvailabilityRuleCommand toCommand(Long hostId) {
        return new CreateAvailabilityRuleCommand(hostId, dayOfWeek, startTime, endTime,
                bufferMinutes, maxBookingsPerDay);
    }
}
