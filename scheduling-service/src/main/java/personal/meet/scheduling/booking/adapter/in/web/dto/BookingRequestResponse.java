package personal.meet.scheduling.booking.adapter.in.web.dto;

import personal.meet.scheduling.booking.domain.model.BookingRequest;
import personal.meet.scheduling.booking.domain.model.BookingRequestStatus;

import java.time.Instant;

/**
 * 예약 요청 조회/생성 응답 DTO
 */
public record BookingRequestResponse(
        Long requestId,
        Long hostId,
        Instant startTime,
        Instant endTime,
        String customerName,
        String customerEmail,
        BookingRequestStatus status,
        String confirmationToken,
        Instant expiresAt,
        Instant createdAt,
        Instant confirmedAt,
        Long bookingId
) {
    public static BookingRequestResponse from(BookingRequest request) {
        return new BookingRequestResponse(
                request.id(),
                request.hostId(),
                request.startTime(),
                request.endTime(),
                request.customer().name(),
                request.customer().email(),
                request.status(),
                request.confirmationToken(),
                request.expiresAt(),
                request.createdAt(),
                request.confirmedAt(),
                request.bookingId()
        );
    }
}
