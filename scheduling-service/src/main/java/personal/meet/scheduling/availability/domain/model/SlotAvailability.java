package personal.meet.scheduling.availability.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Slot Availability
 * 슬롯 생성 결과
 *
 * @param hostId          호스트 ID
 * @param date            호스트 로컬 날짜
 * @param durationMinutes 슬롯 길이
 * @param slots           시간순 정렬된 예약 가능 슬롯
 * @param partial         외부 캘린더 정보 없이 계산된 경우 true
 */
public record SlotAvailability(
        Long hostId,
        LocalDate date,
        int durationMinutes,
        List<Slot> slots,
        boolean partial) {

    public SlotAvailability {
        slots = List.copyOf(slots);
    }

    public static SlotAvailability empty(Long hostId, LocalDate date, int durationMinutes, boolean partial) {
        return new SlotAvailability(hostId, date, durationMinutes, List.of(), partial);
    }
}
