package personal.meet.scheduling.booking.application.port.in;

import personal.meet.scheduling.booking.domain.model.Booking;

/**
 * Create Booking UseCase (Input Port)
 */
public interface CreateBookingUseCase {

    /**
     * @throws personal.meet.scheduling.booking.domain.exception.SlotConflictException 기존 확정 예약과 겹칠 때
     */
    Booking createBooking(CreateBookingCommand command);
}
