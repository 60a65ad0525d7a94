package personal.meet.scheduling.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.meet.scheduling.booking.adapter.in.web.dto.BookingCreateRequest;
import personal.meet.scheduling.booking.adapter.in.web.dto.BookingRescheduleRequest;
import personal.meet.scheduling.booking.adapter.in.web.dto.BookingResponse;
import personal.meet.scheduling.booking.application.port.in.CancelBookingUseCase;
import personal.meet.scheduling.booking.application.port.in.CreateBookingUseCase;
import personal.meet.scheduling.booking.application.port.in.GetBookingsUseCase;
import personal.meet.scheduling.booking.application.port.in.RescheduleBookingUseCase;
import personal.meet.scheduling.booking.domain.model.Booking;

import java.time.Instant;
import java.util.List;

/**
 * Booking API Controller
 * 호스트 예약 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/hosts/{hostId}/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final CreateBookingUseCase createBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;
    private final RescheduleBookingUseCase rescheduleBookingUseCase;
    private final GetBookingsUseCase getBookingsUseCase;

    /**
     * 기간 내 예약 목록
     * GET /api/v1/hosts/{hostId}/bookings?from=...&to=...
     */
    @GetMapping
    public ResponseEntity<List<BookingResponse>> listBookings(
            @PathVariable Long hostId,
            @RequestParam Instant from,
            @RequestParam Instant to
    ) {
        log.info("List bookings: hostId={}, from={}, to={}", hostId, from, to);

        List<BookingResponse> response = getBookingsUseCase.listBookings(hostId, from, to).stream()
                .map(BookingResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/v1/hosts/{hostId}/bookings/{bookingId}
     */
    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingResponse> getBooking(
            @PathVariable Long hostId,
            @PathVariable Long bookingId
    ) {
        return ResponseEntity.ok(BookingResponse.from(getBookingsUseCase.getBooking(hostId, bookingId)));
    }

    /**
     * 호스트 직접 예약
     * POST /api/v1/hosts/{hostId}/bookings
     */
    @PostMapping
    public ResponseEntity<BookingResponse> createBooking(
            @PathVariable Long hostId,
            @Valid @RequestBody BookingCreateRequest request
    ) {
        log.info("Create booking: hostId={}, start={}, end={}", hostId, request.startTime(), request.endTime());

        Booking booking = createBookingUseCase.createBooking(request.toCommand(hostId));

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    /**
     * POST /api/v1/hosts/{hostId}/bookings/{bookingId}/cancel
     */
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<BookingResponse> cancelBooking(
            @PathVariable Long hostId,
            @PathVariable Long bookingId
    ) {
        log.info("Cancel booking: hostId={}, bookingId={}", hostId, bookingId);

        Booking booking = cancelBookingUseCase.cancelBooking(hostId, bookingId);

        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    /**
     * PUT /api/v1/hosts/{hostId}/bookings/{bookingId}/schedule
     */
    @PutMapping("/{bookingId}/schedule")
    public ResponseEntity<BookingResponse> rescheduleBooking(
            @PathVariable Long hostId,
            @PathVariable Long bookingId,
            @Valid @RequestBody BookingRescheduleRequest request
    ) {
        log.info("Reschedule booking: hostId={}, bookingId={}, start={}, end={}",
                hostId, bookingId, request.startTime(), request.endTime());

        Booking booking = rescheduleBookingUseCase.rescheduleBooking(request.toCommand(hostId, bookingId));

        return ResponseEntity.ok(BookingResponse.from(booking));
    }
}
