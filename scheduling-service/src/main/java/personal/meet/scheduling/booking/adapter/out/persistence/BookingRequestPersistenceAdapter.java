package personal.meet.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.booking.application.port.out.BookingRequestRepository;
import personal.meet.scheduling.booking.domain.model.BookingRequest;

import java.util.Optional;

/**
 * Booking Request Persistence Adapter
 * JPA를 사용한 예약 요청 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingRequestPersistenceAdapter implements BookingRequestRepository {

    private final JpaBookingRequestRepository jpaBookingRequestRepository;

    @Override
    public BookingRequest save(BookingRequest request) {
        log.debug("Saving booking request: requestId={}, status={}", request.id(), request.status());
        return jpaBookingRequestRepository.save(BookingRequestEntity.fromDomain(request)).toDomain();
    }

    @Override
    public Optional<BookingRequest> findById(Long requestId) {
        log.debug("Finding booking request: requestId={}", requestId);
        return jpaBookingRequestRepository.findById(requestId)
                .map(BookingRequestEntity::toDomain);
    }

    @Override
    public Optional<BookingRequest> findByToken(String confirmationToken) {
        return jpaBookingRequestRepository.findByConfirmationToken(confirmationToken)
                .map(BookingRequestEntity::toDomain);
    }
}
