package personal.meet.scheduling.booking.domain.model;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.domain.exception.BookingNotFoundException;
import personal.meet.scheduling.booking.domain.exception.InvalidBookingStateException;

import java.time.Instant;

/**
 * Booking Domain Model
 * 호스트의 시간을 점유하는 확정 예약 (불변)
 */
public record Booking(
        Long id,
        Long hostId,
        Instant startTime,
        Instant endTime,
        BookingStatus status,
        CustomerInfo customer,
        Long bookingRequestId,
        Instant createdAt) {

    public Booking {
        if (hostId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Host ID cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TIME, "Booking time cannot be null");
        }
        if (!startTime.isBefore(endTime)) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TIME,
                    String.format("Booking end must be after start: start=%s, end=%s", startTime, endTime));
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (customer == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer cannot be null");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
    }

    /**
     * 호스트 직접 예약 생성 (CONFIRMED)
     */
    public static Booking confirmed(Long hostId, TimeInterval interval, CustomerInfo customer, Instant now) {
        return new Booking(null, hostId, interval.start(), interval.end(),
                BookingStatus.CONFIRMED, customer, null, now);
    }

    /**
     * 예약 요청으로부터 확정 예약 생성
     * 요청 자체를 변경하지 않고 별도의 엔티티를 만든다.
     */
    public static Booking fromRequest(BookingRequest request, Instant now) {
        return new Booking(null, request.hostId(), request.startTime(), request.endTime(),
                BookingStatus.CONFIRMED, request.customer(), request.id(), now);
    }

    /**
     * 예약 취소 (CONFIRMED -> CANCELLED)
     */
    public Booking cancel() {
        ensureConfirmed();
        return new Booking(id, hostId, startTime, endTime,
                BookingStatus.CANCELLED, customer, bookingRequestId, createdAt);
    }

    /**
     * 일정 변경 (CONFIRMED 상태에서만)
     */
    public Booking reschedule(TimeInterval interval) {
        ensureConfirmed();
        return new Booking(id, hostId, interval.start(), interval.end(),
                status, customer, bookingRequestId, createdAt);
    }

    public TimeInterval interval() {
        return new TimeInterval(startTime, endTime);
    }

    public boolean isConfirmed() {
        return status == BookingStatus.CONFIRMED;
    }

    /**
     * 다른 호스트의 예약은 존재하지 않는 것으로 취급
     *
     * @throws BookingNotFoundException 호스트 불일치 시
     */
    public void ensureOwnedBy(Long requestHostId) {
        if (!this.hostId.equals(requestHostId)) {
            throw new BookingNotFoundException(id);
        }
    }

    public void ensureConfirmed() {
        if (!isConfirmed()) {
            throw new InvalidBookingStateException(id, status);
        }
    }
}
