package personal.meet.scheduling.host.domain.model;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

import java.time.ZoneId;

/**
 * Host Domain Model
 * 예약을 받는 호스트의 스케줄링 설정 (불변)
 *
 * @param id                 호스트 ID
 * @param name               표시 이름
 * @param timezone           호스트의 로컬 타임존 (가용 시간 규칙 해석 기준)
 * @param bookingHorizonDays 오늘로부터 예약 가능한 최대 일수
 */
public record Host(
        Long id,
        String name,
        ZoneId timezone,
        int bookingHorizonDays
) {
    public Host {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host name cannot be null or blank");
        }
        if (timezone == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host timezone cannot be null");
        }
        if (bookingHorizonDays <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking horizon must be positive");
        }
    }
}
