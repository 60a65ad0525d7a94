package personal.meet.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code, 에러 분류, 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "C002", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ErrorType.INTERNAL, "C003", "서버 내부 오류가 발생했습니다."),

    // Host Domain (Hxxx)
    HOST_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "H001", "호스트를 찾을 수 없습니다."),

    // Availability Domain (Axxx)
    INVALID_AVAILABILITY_RULE(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "A001", "유효하지 않은 가용 시간 규칙입니다."),
    AVAILABILITY_RULE_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "A002", "가용 시간 규칙을 찾을 수 없습니다."),
    INVALID_SLOT_DURATION(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "A003", "예약 길이가 허용 범위를 벗어났습니다."),
    DATE_OUT_OF_RANGE(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "A004", "예약할 수 없는 날짜입니다."),
    SLOT_OUTSIDE_AVAILABILITY(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "A005", "호스트의 가용 시간이 아닙니다."),
    CALENDAR_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, ErrorType.UNAVAILABLE, "A006", "외부 캘린더 정보를 가져올 수 없습니다."),

    // Booking Domain (Bxxx)
    INVALID_BOOKING_TIME(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "B001", "종료 시간은 시작 시간 이후여야 합니다."),
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "B002", "예약을 찾을 수 없습니다."),
    BOOKING_REQUEST_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "B003", "예약 요청을 찾을 수 없습니다."),
    SLOT_TAKEN(HttpStatus.CONFLICT, ErrorType.CONFLICT, "B004", "다른 사용자가 방금 이 시간을 예약했습니다."),
    BOOKING_REQUEST_EXPIRED(HttpStatus.GONE, ErrorType.EXPIRED, "B005", "예약 요청이 만료되었습니다."),
    INVALID_BOOKING_REQUEST_STATE(HttpStatus.CONFLICT, ErrorType.INVALID_STATE, "B006", "예약 요청을 처리할 수 없는 상태입니다."),
    INVALID_BOOKING_STATE(HttpStatus.CONFLICT, ErrorType.INVALID_STATE, "B007", "예약을 처리할 수 없는 상태입니다."),
    CONFIRMATION_IN_PROGRESS(HttpStatus.CONFLICT, ErrorType.CONFLICT, "B008", "이미 확정 처리 중인 요청입니다.");

    private final HttpStatus httpStatus;
    private final ErrorType type;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, ErrorType type, String code, String message) {
        this.httpStatus = httpStatus;
        this.type = type;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public ErrorType getType() {
        return type;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
