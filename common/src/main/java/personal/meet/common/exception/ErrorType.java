package personal.meet.common.exception;

/**
 * Error Type
 * 에러 분류 (닫힌 집합). 모든 ErrorCode는 정확히 하나의 타입에 속한다.
 */
public enum ErrorType {
    /**
     * 잘못된 입력 (범위를 벗어난 duration, 과거/호라이즌 밖 날짜 등)
     */
    VALIDATION,

    /**
     * 존재하지 않는 리소스 (호스트, 토큰, 예약)
     */
    NOT_FOUND,

    /**
     * 시간대 충돌 (요청 생성 또는 확정 시점)
     */
    CONFLICT,

    /**
     * 확정 유효 시간 초과
     */
    EXPIRED,

    /**
     * PENDING이 아닌 상태에서의 전이 시도
     */
    INVALID_STATE,

    /**
     * 외부 캘린더 일시적 불가
     */
    UNAVAILABLE,

    INTERNAL
}
