package personal.meet.scheduling.booking.adapter.in.web.dto;

import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingStatus;

import java.time.Instant;

/**
 * 예약 응답 DTO
 */
public record BookingResponse(
        Long bookingId,
        Long hostId,
        Instant startTime,
        Instant endTime,
        BookingStatus status,
        String customerName,
        String customerEmail,
        String customerPhone,
        String notes,
        Long bookingRequestId,
        Instant createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.id(),
                booking.hostId(),
                booking.startTime(),
                booking.endTime(),
                booking.status(),
                booking.customer().name(),
                booking.customer().email(),
                booking.customer().phone(),
                booking.customer().notes(),
                booking.bookingRequestId(),
                booking.createdAt()
        );
    }
}
