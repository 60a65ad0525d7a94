package personal.meet.scheduling.booking.application.port.out;

import personal.meet.scheduling.booking.domain.model.TimeInterval;

/**
 * Slot Verification Port (Output Port)
 * Availability 도메인에 슬롯 재검증을 위임
 */
public interface SlotVerificationPort {

    /**
     * @return 외부 캘린더 정보 없이 판단했으면 true
     */
    boolean verifyBookable(Long hostId, TimeInterval slot);
}
