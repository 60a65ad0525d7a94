package personal.meet.scheduling.availability.adapter.in.web.dto;

import personal.meet.scheduling.availability.domain.model.Slot;
import personal.meet.scheduling.availability.domain.model.SlotAvailability;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 슬롯 조회 응답 DTO
 * partial=true면 외부 캘린더 정보 없이 계산된 결과
 */
public record SlotAvailabilityResponse(
        Long hostId,
        LocalDate date,
        int durationMinutes,
        List<SlotResponse> slots,
        boolean partial
) {
    public record SlotResponse(
            Instant start,
            Instant end
    ) {
        static SlotResponse from(Slot slot) {
            return new SlotResponse(slot.start(), slot.end());
        }
    }

    public static SlotAvailabilityResponse from(SlotAvailability availability) {
        return new SlotAvailabilityResponse(
                availability.hostId(),
                availability.date(),
                availability.durationMinutes(),
                availability.slots().stream().map(SlotResponse::from).toList(),
                availability.partial()
        );
    }
}
