package personal.meet.scheduling.availability.application.port.in;

import personal.meet.scheduling.booking.domain.model.TimeInterval;

/**
 * Verify Slot UseCase (Input Port)
 * 구체적인 구간 하나가 지금 예약 가능한지 슬롯 생성과 같은 규칙으로 재검증
 */
public interface VerifySlotUseCase {

    /**
     * @return 외부 캘린더 정보 없이 판단했으면 true (partial)
     * @throws personal.meet.scheduling.availability.domain.exception.InvalidSlotRequestException 입력 오류, 가용 시간 밖
     * @throws personal.meet.scheduling.booking.domain.exception.SlotConflictException 이미 점유되었거나 하루 한도 도달
     */
    boolean verifyBookable(Long hostId, TimeInterval interval);
}
