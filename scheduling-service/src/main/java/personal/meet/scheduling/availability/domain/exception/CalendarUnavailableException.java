package personal.meet.scheduling.availability.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

/**
 * Calendar Unavailable Exception
 * 외부 캘린더 동기화 서비스에 연결할 수 없을 때 (Circuit Breaker Open, 5xx, Timeout 등)
 * 슬롯 계산에서는 실패가 아니라 partial 결과로 강등된다.
 */
public class CalendarUnavailableException extends BusinessException {
    public CalendarUnavailableException(Long hostId) {
        super(ErrorCode.CALENDAR_UNAVAILABLE,
                String.format("External calendar data unavailable: hostId=%d", hostId));
    }

    public CalendarUnavailableException(Long hostId, Throwable cause) {
        super(ErrorCode.CALENDAR_UNAVAILABLE,
                String.format("External calendar data unavailable: hostId=%d", hostId), cause);
    }
}
