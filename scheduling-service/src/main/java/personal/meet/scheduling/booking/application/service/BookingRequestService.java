package personal.meet.scheduling.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.meet.scheduling.booking.application.port.in.CancelBookingRequestUseCase;
import personal.meet.scheduling.booking.application.port.in.CreateBookingRequestCommand;
import personal.meet.scheduling.booking.application.port.in.CreateBookingRequestUseCase;
import personal.meet.scheduling.booking.application.port.in.GetBookingRequestUseCase;
import personal.meet.scheduling.booking.application.port.out.BookingRequestRepository;
import personal.meet.scheduling.booking.application.port.out.SlotVerificationPort;
import personal.meet.scheduling.booking.domain.exception.BookingRequestNotFoundException;
import personal.meet.scheduling.booking.domain.exception.InvalidBookingRequestStateException;
import personal.meet.scheduling.booking.domain.model.BookingRequest;
import personal.meet.scheduling.booking.domain.model.BookingRequestStatus;
import personal.meet.scheduling.booking.domain.service.BookingConfirmationManager;
import personal.meet.scheduling.config.SchedulingProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Booking Request Service
 * 예약 요청 생성, 조회, 취소
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingRequestService implements CreateBookingRequestUseCase, GetBookingRequestUseCase,
        CancelBookingRequestUseCase {

    private final BookingRequestRepository bookingRequestRepository;
    private final SlotVerificationPort slotVerificationPort;
    private final BookingConfirmationManager bookingConfirmationManager;
    private final SchedulingProperties properties;
    private final Clock clock;

    @Override
    public BookingRequest createRequest(CreateBookingRequestCommand command) {
        // 이전에 받은 슬롯 목록을 믿지 않고 현재 상태로 재검증
        boolean partial = slotVerificationPort.verifyBookable(command.hostId(), command.slot());

        Instant now = clock.instant();
        BookingRequest request = BookingRequest.create(
                command.hostId(),
                command.slot(),
                command.customer(),
                UUID.randomUUID().toString(),
                now,
                properties.request().holdWindow());
        BookingRequest saved = bookingRequestRepository.save(request);

        log.info("Booking request created: requestId={}, hostId={}, start={}, expiresAt={}, partial={}",
                saved.id(), saved.hostId(), saved.startTime(), saved.expiresAt(), partial);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public BookingRequest getRequest(String confirmationToken) {
        return bookingRequestRepository.findByToken(confirmationToken)
                .map(request -> request.asSeenAt(clock.instant()))
                .orElseThrow(() -> {
                    log.warn("Booking request not found for token");
                    return new BookingRequestNotFoundException();
                });
    }

    @Override
    public BookingRequest cancelRequest(Long requestId) {
        BookingRequest request = bookingRequestRepository.findById(requestId)
                .orElseThrow(() -> {
                    log.warn("Booking request not found: requestId={}", requestId);
                    return new BookingRequestNotFoundException(requestId);
                });
        request.ensurePending();

        BookingRequest result = bookingConfirmationManager.cancelRequestInTransaction(
                request.hostId(), requestId, clock.instant());
        if (result.status() == BookingRequestStatus.EXPIRED) {
            throw new InvalidBookingRequestStateException(requestId, BookingRequestStatus.EXPIRED);
        }
        return result;
    }
}
