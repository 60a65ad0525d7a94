package personal.meet.scheduling.booking.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.domain.model.TimeInterval;

/**
 * Slot Conflict Exception
 * 요청한 시간이 이미 확정 예약(또는 외부 일정)과 겹칠 때 발생 (409 time slot taken)
 * 확정 경쟁에서 밀린 경우의 정상적인 결과이기도 하다.
 */
public class SlotConflictException extends BusinessException {
    public SlotConflictException(Long hostId, TimeInterval interval) {
        super(ErrorCode.SLOT_TAKEN,
                String.format("Time slot is no longer available: hostId=%d, start=%s, end=%s",
                        hostId, interval.start(), interval.end()));
    }

    public SlotConflictException(Long hostId, TimeInterval interval, Throwable cause) {
        super(ErrorCode.SLOT_TAKEN,
                String.format("Time slot rejected by storage constraint: hostId=%d, start=%s, end=%s",
                        hostId, interval.start(), interval.end()),
                cause);
    }

    public SlotConflictException(String detail) {
        super(ErrorCode.SLOT_TAKEN, detail);
    }
}
