package personal.meet.scheduling.booking.application.port.in;

import personal.meet.scheduling.booking.domain.model.Booking;

/**
 * Confirm Booking Request UseCase (Input Port)
 * 멱등하지 않다. 이미 확정된 요청의 재확정은 InvalidState로 실패한다.
 */
public interface ConfirmBookingRequestUseCase {

    /**
     * @return 생성된 확정 예약
     * @throws personal.meet.scheduling.booking.domain.exception.BookingRequestNotFoundException      알 수 없는 토큰
     * @throws personal.meet.scheduling.booking.domain.exception.InvalidBookingRequestStateException  PENDING이 아님
     * @throws personal.meet.scheduling.booking.domain.exception.BookingRequestExpiredException       만료 시각 경과
     * @throws personal.meet.scheduling.booking.domain.exception.SlotConflictException                경쟁에서 밀림
     */
    Booking confirmRequest(String confirmationToken);
}
