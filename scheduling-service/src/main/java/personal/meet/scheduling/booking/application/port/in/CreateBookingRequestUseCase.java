package personal.meet.scheduling.booking.application.port.in;

import personal.meet.scheduling.booking.domain.model.BookingRequest;

/**
 * Create Booking Request UseCase (Input Port)
 */
public interface CreateBookingRequestUseCase {

    /**
     * 슬롯을 재검증한 뒤 PENDING 요청 생성
     *
     * @throws personal.meet.scheduling.booking.domain.exception.SlotConflictException 슬롯이 더 이상 비어있지 않을 때
     */
    BookingRequest createRequest(CreateBookingRequestCommand command);
}
