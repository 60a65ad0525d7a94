package personal.meet.scheduling.booking.application.port.in;

import personal.meet.scheduling.booking.domain.model.BookingRequest;

/**
 * Get Booking Request UseCase (Input Port)
 */
public interface GetBookingRequestUseCase {

    /**
     * 확정 토큰으로 조회. 만료 시각이 지난 PENDING 요청은 EXPIRED로 보인다 (저장하지 않음).
     */
    BookingRequest getRequest(String confirmationToken);
}
