package personal.meet.scheduling.booking.application.port.out;

import personal.meet.scheduling.booking.domain.model.BookingRequest;

import java.util.Optional;

/**
 * Booking Request Repository (Output Port)
 */
public interface BookingRequestRepository {

    BookingRequest save(BookingRequest request);

    Optional<BookingRequest> findById(Long requestId);

    Optional<BookingRequest> findByToken(String confirmationToken);
}
