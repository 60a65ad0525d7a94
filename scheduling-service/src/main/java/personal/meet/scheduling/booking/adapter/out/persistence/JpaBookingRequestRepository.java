package personal.meet.scheduling.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for BookingRequest
 */
public interface JpaBookingRequestRepository extends JpaRepository<BookingRequestEntity, Long> {

    Optional<BookingRequestEntity> findByConfirmationToken(String confirmationToken);
}
