package personal.meet.scheduling.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.booking.application.port.out.BookingRepository;
import personal.meet.scheduling.booking.application.port.out.BookingRequestRepository;
import personal.meet.scheduling.booking.domain.exception.BookingNotFoundException;
import personal.meet.scheduling.booking.domain.exception.BookingRequestNotFoundException;
import personal.meet.scheduling.booking.domain.exception.SlotConflictException;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingRequest;
import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.time.Instant;
import java.util.List;

/**
 * Booking Confirmation Manager (Transaction Manager)
 * 호스트 예약 집합을 변경하는 모든 쓰기는 여기서 BookingRepository.runAtomic 안에서 수행된다.
 * 겹침 재검사와 삽입이 같은 작업 단위에 있으므로 검사 후 삽입 사이에 다른 확정이 끼어들 수 없다.
 * Domain Layer에 속하며 Port에만 의존
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingConfirmationManager {

    private final BookingRepository bookingRepository;
    private final BookingRequestRepository bookingRequestRepository;

    /**
     * 원자적 확정
     * 1. 요청 재조회 (여전히 PENDING이어야 함)
     * 2. 현재 확정 예약과 겹침 재검사
     * 3. Booking 삽입 + 요청 CONFIRMED 저장 (함께 커밋)
     */
    public Booking confirmInTransaction(Long hostId, Long requestId, Instant now) {
        return bookingRepository.runAtomic(hostId, () -> {
            BookingRequest request = bookingRequestRepository.findById(requestId)
                    .orElseThrow(() -> new BookingRequestNotFoundException(requestId));
            request.ensurePending();

            ensureNoOverlap(hostId, request.interval(), null);

            Booking booking = bookingRepository.insertConfirmed(Booking.fromRequest(request, now));
            bookingRequestRepository.save(request.confirm(booking.id(), now));

            log.info("Booking request confirmed: requestId={}, bookingId={}, hostId={}",
                    requestId, booking.id(), hostId);
            return booking;
        });
    }

    /**
     * 호스트 직접 예약 (겹침 검사 + 삽입)
     */
    public Booking createInTransaction(Booking booking) {
        return bookingRepository.runAtomic(booking.hostId(), () -> {
            ensureNoOverlap(booking.hostId(), booking.interval(), null);

            Booking saved = bookingRepository.insertConfirmed(booking);
            log.info("Booking created: bookingId={}, hostId={}", saved.id(), saved.hostId());
            return saved;
        });
    }

    /**
     * 일정 변경 (자기 자신을 제외한 확정 예약과 겹침 검사 후 갱신)
     */
    public Booking rescheduleInTransaction(Long hostId, Long bookingId, TimeInterval newInterval) {
        return bookingRepository.runAtomic(hostId, () -> {
            Booking booking = bookingRepository.findById(bookingId)
                    .orElseThrow(() -> new BookingNotFoundException(bookingId));
            booking.ensureOwnedBy(hostId);

            Booking rescheduled = booking.reschedule(newInterval);
            ensureNoOverlap(hostId, newInterval, bookingId);

            Booking saved = bookingRepository.save(rescheduled);
            log.info("Booking rescheduled: bookingId={}, start={}, end={}",
                    bookingId, saved.startTime(), saved.endTime());
            return saved;
        });
    }

    /**
     * 예약 취소 (CONFIRMED -> CANCELLED)
     * 호스트 락 아래에서 재조회하므로 동시에 진행 중인 일정 변경과 직렬화된다.
     */
    public Booking cancelBookingInTransaction(Long hostId, Long bookingId) {
        return bookingRepository.runAtomic(hostId, () -> {
            Booking booking = bookingRepository.findById(bookingId)
                    .orElseThrow(() -> new BookingNotFoundException(bookingId));
            booking.ensureOwnedBy(hostId);

            Booking cancelled = bookingRepository.save(booking.cancel());
            log.info("Booking cancelled: bookingId={}, hostId={}", bookingId, hostId);
            return cancelled;
        });
    }

    /**
     * 예약 요청 취소 (PENDING -> CANCELLED)
     * 확정과 같은 호스트 락을 잡으므로, 먼저 커밋된 확정이 있으면 재조회에서 드러나 InvalidState로 실패한다.
     * 이미 만료 시각이 지난 요청은 EXPIRED로 저장한 결과를 반환한다.
     */
    public BookingRequest cancelRequestInTransaction(Long hostId, Long requestId, Instant now) {
        return bookingRepository.runAtomic(hostId, () -> {
            BookingRequest request = bookingRequestRepository.findById(requestId)
                    .orElseThrow(() -> new BookingRequestNotFoundException(requestId));

            if (request.isExpiredAt(now)) {
                log.info("Booking request expired on cancel: requestId={}", requestId);
                return bookingRequestRepository.save(request.expire());
            }

            BookingRequest cancelled = bookingRequestRepository.save(request.cancel());
            log.info("Booking request cancelled: requestId={}", requestId);
            return cancelled;
        });
    }

    /**
     * 요청이 여전히 PENDING일 때만 EXPIRED로 저장
     *
     * @return 만료 처리했으면 true
     */
    public boolean expireIfPending(Long hostId, Long requestId) {
        return bookingRepository.runAtomic(hostId, () -> bookingRequestRepository.findById(requestId)
                .filter(BookingRequest::isPending)
                .map(pending -> {
                    bookingRequestRepository.save(pending.expire());
                    return true;
                })
                .orElse(false));
    }

    private void ensureNoOverlap(Long hostId, TimeInterval candidate, Long excludedBookingId) {
        List<TimeInterval> existing = bookingRepository
                .findConfirmedByHostBetween(hostId, candidate.start(), candidate.end()).stream()
                .filter(b -> excludedBookingId == null || !excludedBookingId.equals(b.id()))
                .map(Booking::interval)
                .toList();

        if (ConflictChecker.anyOverlap(candidate, existing)) {
            log.warn("Overlapping confirmed booking: hostId={}, start={}, end={}",
                    hostId, candidate.start(), candidate.end());
            throw new SlotConflictException(hostId, candidate);
        }
    }
}
