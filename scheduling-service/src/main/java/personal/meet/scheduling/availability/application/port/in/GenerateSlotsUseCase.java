package personal.meet.scheduling.availability.application.port.in;

import personal.meet.scheduling.availability.domain.model.SlotAvailability;

import java.time.LocalDate;

/**
 * Generate Slots UseCase (Input Port)
 * 호출마다 새로 계산하며 캐시하지 않는다.
 */
public interface GenerateSlotsUseCase {

    /**
     * @param hostId          호스트 ID
     * @param date            호스트 로컬 날짜
     * @param durationMinutes 슬롯 길이 (분)
     * @return 시간순 슬롯과 partial 여부
     * @throws personal.meet.scheduling.availability.domain.exception.InvalidSlotRequestException
     *         duration 범위 밖, 과거 날짜, 호라이즌 초과
     */
    SlotAvailability generateSlots(Long hostId, LocalDate date, int durationMinutes);
}
