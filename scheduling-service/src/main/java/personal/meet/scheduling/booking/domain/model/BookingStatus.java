package personal.meet.scheduling.booking.domain.model;

/**
 * Booking Status Enum
 * 확정된 예약의 상태
 */
public enum BookingStatus {
    /**
     * 확정 (겹침 검사 대상)
     */
    CONFIRMED,

    /**
     * 취소 (기록은 보존, 겹침 검사에서 제외)
     */
    CANCELLED
}
