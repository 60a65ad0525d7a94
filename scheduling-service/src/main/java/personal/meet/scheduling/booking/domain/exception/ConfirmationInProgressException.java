package personal.meet.scheduling.booking.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

/**
 * Confirmation In Progress Exception
 * 같은 요청에 대한 확정이 이미 진행 중일 때 (Redis 선점 실패)
 */
public class ConfirmationInProgressException extends BusinessException {
    public ConfirmationInProgressException(Long requestId) {
        super(ErrorCode.CONFIRMATION_IN_PROGRESS,
                String.format("Confirmation already in progress: requestId=%d", requestId));
    }
}
