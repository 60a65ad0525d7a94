package personal.meet.scheduling.booking.adapter.out.availability;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.availability.application.port.in.VerifySlotUseCase;
import personal.meet.scheduling.booking.application.port.out.SlotVerificationPort;
import personal.meet.scheduling.booking.domain.model.TimeInterval;

/**
 * Slot Verification Adapter
 * Availability 도메인의 유스케이스로 슬롯 재검증
 */
@Component
@RequiredArgsConstructor
public class SlotVerificationAdapter implements SlotVerificationPort {

    private final VerifySlotUseCase verifySlotUseCase;

    @Override
    public boolean verifyBookable(Long hostId, TimeInterval slot) {
        return verifySlotUseCase.verifyBookable(hostId, slot);
    }
}
