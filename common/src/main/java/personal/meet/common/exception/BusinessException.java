package personal.meet.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외의 최상위 타입
 * ErrorCode로 분류와 HTTP 상태를 결정하고, message에는 상세 정보를 담는다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }

    public ErrorType getErrorType() {
        return errorCode.getType();
    }
}
