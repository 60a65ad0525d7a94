package personal.meet.scheduling.availability.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

/**
 * Invalid Slot Request Exception
 * 슬롯 조회/검증 입력 오류 (duration 범위, 과거 날짜, 호라이즌 초과, 가용 시간 밖)
 */
public class InvalidSlotRequestException extends BusinessException {

    private InvalidSlotRequestException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }

    public static InvalidSlotRequestException durationOutOfRange(long durationMinutes, int min, int max) {
        return new InvalidSlotRequestException(ErrorCode.INVALID_SLOT_DURATION,
                String.format("Duration must be between %d and %d minutes: duration=%d", min, max, durationMinutes));
    }

    public static InvalidSlotRequestException dateOutOfRange(String detail) {
        return new InvalidSlotRequestException(ErrorCode.DATE_OUT_OF_RANGE, detail);
    }

    public static InvalidSlotRequestException outsideAvailability(Long hostId, Object start, Object end) {
        return new InvalidSlotRequestException(ErrorCode.SLOT_OUTSIDE_AVAILABILITY,
                String.format("Requested time is outside host availability: hostId=%d, start=%s, end=%s",
                        hostId, start, end));
    }
}
