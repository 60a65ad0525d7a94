package personal.meet.scheduling.booking.domain.model;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.domain.exception.InvalidBookingRequestStateException;

import java.time.Duration;
import java.time.Instant;

/**
 * Booking Request Domain Model
 * 고객 확정 전 슬롯을 일정 시간 점유하는 예약 요청 (불변)
 *
 * <p>상태 전이: PENDING -> CONFIRMED | EXPIRED | CANCELLED. 종료 상태에서는 전이 불가.
 * 만료 시각이 지난 PENDING 요청은 읽기 시점에 EXPIRED로 간주하고, 다음 쓰기 시점에 저장한다.
 */
public record BookingRequest(
        Long id,
        Long hostId,
        Instant startTime,
        Instant endTime,
        CustomerInfo customer,
        String confirmationToken,
        BookingRequestStatus status,
        Instant expiresAt,
        Instant createdAt,
        Instant confirmedAt,
        Long bookingId) {

    public BookingRequest {
        if (hostId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host ID cannot be null");
        }
        if (startTime == null || endTime == null || !startTime.isBefore(endTime)) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TIME,
                    String.format("Requested end must be after start: start=%s, end=%s", startTime, endTime));
        }
        if (customer == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer cannot be null");
        }
        if (confirmationToken == null || confirmationToken.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Confirmation token cannot be null or blank");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Request status cannot be null");
        }
        if (expiresAt == null || createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Request timestamps cannot be null");
        }
        if (!expiresAt.isAfter(createdAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Expiration must be after creation: createdAt=%s, expiresAt=%s",
                            createdAt, expiresAt));
        }
    }

    /**
     * 예약 요청 생성 (정적 팩토리 메서드)
     *
     * @param hostId     호스트 ID
     * @param slot       요청 구간
     * @param customer   고객 정보
     * @param token      확정 토큰
     * @param now        현재 시각
     * @param holdWindow 점유 유지 시간
     * @return 새로운 요청 (PENDING 상태)
     */
    public static BookingRequest create(Long hostId, TimeInterval slot, CustomerInfo customer,
                                        String token, Instant now, Duration holdWindow) {
        return new BookingRequest(null, hostId, slot.start(), slot.end(), customer, token,
                BookingRequestStatus.PENDING, now.plus(holdWindow), now, null, null);
    }

    /**
     * 예약 요청 확정 (PENDING -> CONFIRMED)
     */
    public BookingRequest confirm(Long createdBookingId, Instant now) {
        ensurePending();
        return new BookingRequest(id, hostId, startTime, endTime, customer, confirmationToken,
                BookingRequestStatus.CONFIRMED, expiresAt, createdAt, now, createdBookingId);
    }

    /**
     * 예약 요청 만료 (PENDING -> EXPIRED)
     * 시간 초과 또는 확정 경쟁에서 밀린 경우
     */
    public BookingRequest expire() {
        ensurePending();
        return withStatus(BookingRequestStatus.EXPIRED);
    }

    /**
     * 예약 요청 취소 (PENDING -> CANCELLED)
     */
    public BookingRequest cancel() {
        ensurePending();
        return withStatus(BookingRequestStatus.CANCELLED);
    }

    /**
     * 저장된 상태가 PENDING이지만 만료 시각이 지났는지 여부
     */
    public boolean isExpiredAt(Instant now) {
        return status == BookingRequestStatus.PENDING && now.isAfter(expiresAt);
    }

    /**
     * 읽기 시점의 실제 상태 (lazy expiry)
     */
    public BookingRequestStatus effectiveStatus(Instant now) {
        return isExpiredAt(now) ? BookingRequestStatus.EXPIRED : status;
    }

    /**
     * 읽기 시점 기준으로 보이는 모습. 저장하지 않는다.
     */
    public BookingRequest asSeenAt(Instant now) {
        return isExpiredAt(now) ? withStatus(BookingRequestStatus.EXPIRED) : this;
    }

    public TimeInterval interval() {
        return new TimeInterval(startTime, endTime);
    }

    public boolean isPending() {
        return status == BookingRequestStatus.PENDING;
    }

    /**
     * PENDING 상태 검증
     *
     * @throws InvalidBookingRequestStateException PENDING 상태가 아닐 때
     */
    public void ensurePending() {
        if (!isPending()) {
            throw new InvalidBookingRequestStateException(id, status);
        }
    }

    private BookingRequest withStatus(BookingRequestStatus newStatus) {
        return new BookingRequest(id, hostId, startTime, endTime, customer, confirmationToken,
                newStatus, expiresAt, createdAt, confirmedAt, bookingId);
    }
}
