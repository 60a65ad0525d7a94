package personal.meet.common.exception;

/**
 * 에러 응답 포맷
 *
 * @param result  항상 "error"
 * @param type    에러 분류
 * @param code    에러 코드 (예: B004)
 * @param message 사용자 메시지
 */
public record ErrorResponse(
        String result,
        ErrorType type,
        String code,
        String message
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse("error", errorCode.getType(), errorCode.getCode(), message);
    }
}
