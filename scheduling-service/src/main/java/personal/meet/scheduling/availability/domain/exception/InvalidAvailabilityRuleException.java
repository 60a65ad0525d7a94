package personal.meet.scheduling.availability.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

/**
 * Invalid Availability Rule Exception
 * 규칙 불변식 위반 (시작 >= 종료, 요일 범위 밖, 음수 버퍼 등)
 */
public class InvalidAvailabilityRuleException extends BusinessException {
    public InvalidAvailabilityRuleException(String detail) {
        super(ErrorCode.INVALID_AVAILABILITY_RULE, detail);
    }
}
