package personal.meet.scheduling.booking.domain.model;

/**
 * Booking Request Status Enum
 * 예약 요청 상태. PENDING만 다른 상태로 전이할 수 있다.
 */
public enum BookingRequestStatus {
    /**
     * 고객 확정 대기 중 (슬롯 임시 점유)
     */
    PENDING,

    /**
     * 확정 완료 (Booking 생성됨)
     */
    CONFIRMED,

    /**
     * 시간 만료 또는 경쟁에서 밀림
     */
    EXPIRED,

    /**
     * 고객 취소
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
