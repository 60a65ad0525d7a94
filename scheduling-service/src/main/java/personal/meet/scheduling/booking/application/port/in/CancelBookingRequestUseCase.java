package personal.meet.scheduling.booking.application.port.in;

import personal.meet.scheduling.booking.domain.model.BookingRequest;

/**
 * Cancel Booking Request UseCase (Input Port)
 */
public interface CancelBookingRequestUseCase {

    BookingRequest cancelRequest(Long requestId);
}
