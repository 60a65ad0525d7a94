package personal.meet.scheduling.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.meet.scheduling.booking.adapter.in.web.dto.BookingRequestCreateRequest;
import personal.meet.scheduling.booking.adapter.in.web.dto.BookingRequestResponse;
import personal.meet.scheduling.booking.adapter.in.web.dto.BookingResponse;
import personal.meet.scheduling.booking.application.port.in.CancelBookingRequestUseCase;
import personal.meet.scheduling.booking.application.port.in.ConfirmBookingRequestUseCase;
import personal.meet.scheduling.booking.application.port.in.CreateBookingRequestUseCase;
import personal.meet.scheduling.booking.application.port.in.GetBookingRequestUseCase;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingRequest;

/**
 * Booking Request API Controller
 * 고객 예약 요청 생성, 조회, 확정, 취소 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BookingRequestController {

    private final CreateBookingRequestUseCase createBookingRequestUseCase;
    private final GetBookingRequestUseCase getBookingRequestUseCase;
    private final ConfirmBookingRequestUseCase confirmBookingRequestUseCase;
    private final CancelBookingRequestUseCase cancelBookingRequestUseCase;

    /**
     * 예약 요청 생성
     * POST /api/v1/hosts/{hostId}/booking-requests
     */
    @PostMapping("/hosts/{hostId}/booking-requests")
    public ResponseEntity<BookingRequestResponse> createRequest(
            @PathVariable Long hostId,
            @Valid @RequestBody BookingRequestCreateRequest request
    ) {
        log.info("Create booking request: hostId={}, start={}, end={}",
                hostId, request.startTime(), request.endTime());

        BookingRequest created = createBookingRequestUseCase.createRequest(request.toCommand(hostId));

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingRequestResponse.from(created));
    }

    /**
     * 예약 요청 조회
     * GET /api/v1/booking-requests/{token}
     */
    @GetMapping("/booking-requests/{token}")
    public ResponseEntity<BookingRequestResponse> getRequest(@PathVariable String token) {
        BookingRequest request = getBookingRequestUseCase.getRequest(token);
        return ResponseEntity.ok(BookingRequestResponse.from(request));
    }

    /**
     * 예약 요청 확정
     * POST /api/v1/booking-requests/{token}/confirm
     */
    @PostMapping("/booking-requests/{token}/confirm")
    public ResponseEntity<BookingResponse> confirmRequest(@PathVariable String token) {
        log.info("Confirm booking request");

        Booking booking = confirmBookingRequestUseCase.confirmRequest(token);

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    /**
     * 예약 요청 취소
     * POST /api/v1/booking-requests/id/{requestId}/cancel
     */
    @PostMapping("/booking-requests/id/{requestId}/cancel")
    public ResponseEntity<BookingRequestResponse> cancelRequest(@PathVariable Long requestId) {
        log.info("Cancel booking request: requestId={}", requestId);

        BookingRequest cancelled = cancelBookingRequestUseCase.cancelRequest(requestId);

        return ResponseEntity.ok(BookingRequestResponse.from(cancelled));
    }
}
