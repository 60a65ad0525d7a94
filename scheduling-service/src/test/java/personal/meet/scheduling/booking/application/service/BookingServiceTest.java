package personal.meet.scheduling.booking.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.application.port.in.CreateBookingCommand;
import personal.meet.scheduling.booking.application.port.in.RescheduleBookingCommand;
import personal.meet.scheduling.booking.application.port.out.BookingRepository;
import personal.meet.scheduling.booking.application.port.out.NotificationPublisher;
import personal.meet.scheduling.booking.domain.exception.BookingNotFoundException;
import personal.meet.scheduling.booking.domain.exception.InvalidBookingStateException;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingStatus;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;
import personal.meet.scheduling.booking.domain.model.TimeInterval;
import personal.meet.scheduling.booking.domain.service.BookingConfirmationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingService 단위 테스트")
class BookingServiceTest {

    private static final Long HOST_ID = 1L;
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final TimeInterval SLOT = TimeInterval.ofMinutes(Instant.parse("2026-03-02T01:00:00Z"), 60);
    private static final CustomerInfo CUSTOMER = CustomerInfo.of("Kim", "kim@example.com");

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private BookingConfirmationManager bookingConfirmationManager;

    @Mock
    private NotificationPublisher notificationPublisher;

    private BookingService bookingService;

    @BeforeEach
    void setUp() {
        bookingService = new BookingService(bookingRepository, bookingConfirmationManager, notificationPublisher,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Booking booking(Long id, Instant start) {
        return new Booking(id, HOST_ID, start, start.plusSeconds(3600), BookingStatus.CONFIRMED, CUSTOMER, null, NOW);
    }

    @Test
    @DisplayName("호스트 직접 예약 생성 후 확정 이벤트 발행")
    void createBooking() {
        // given
        Booking saved = booking(10L, SLOT.start());
        given(bookingConfirmationManager.createInTransaction(any(Booking.class))).willReturn(saved);

        // when
        Booking created = bookingService.createBooking(
                new CreateBookingCommand(HOST_ID, SLOT.start(), SLOT.end(), CUSTOMER));

        // then
        assertThat(created).isEqualTo(saved);
        then(notificationPublisher).should().bookingConfirmed(saved);
    }

    @Test
    @DisplayName("예약 취소 후 취소 이벤트 발행")
    void cancelBooking() {
        // given
        Booking confirmed = booking(10L, SLOT.start());
        given(bookingRepository.findById(10L)).willReturn(Optional.of(confirmed));
        given(bookingConfirmationManager.cancelBookingInTransaction(HOST_ID, 10L)).willReturn(confirmed.cancel());

        // when
        Booking cancelled = bookingService.cancelBooking(HOST_ID, 10L);

        // then
        assertThat(cancelled.status()).isEqualTo(BookingStatus.CANCELLED);
        then(notificationPublisher).should().bookingCancelled(cancelled);
    }

    @Test
    @DisplayName("이미 취소된 예약은 다시 취소할 수 없다")
    void cancelBooking_AlreadyCancelled() {
        // given
        given(bookingRepository.findById(10L)).willReturn(Optional.of(booking(10L, SLOT.start())));
        given(bookingConfirmationManager.cancelBookingInTransaction(HOST_ID, 10L))
                .willThrow(new InvalidBookingStateException(10L, BookingStatus.CANCELLED));

        // when & then
        assertThatThrownBy(() -> bookingService.cancelBooking(HOST_ID, 10L))
                .isInstanceOf(InvalidBookingStateException.class);
        then(bookingRepository).should(never()).save(any());
        then(notificationPublisher).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("다른 호스트의 예약 조회는 실패")
    void getBooking_OtherHost() {
        // given
        given(bookingRepository.findById(10L)).willReturn(Optional.of(booking(10L, SLOT.start())));

        // when & then
        assertThatThrownBy(() -> bookingService.getBooking(2L, 10L))
                .isInstanceOf(BookingNotFoundException.class);
    }

    @Test
    @DisplayName("일정 변경은 원자적 작업 단위에 위임")
    void rescheduleBooking() {
        // given
        TimeInterval moved = TimeInterval.ofMinutes(SLOT.end(), 60);
        Booking rescheduled = booking(10L, moved.start());
        given(bookingConfirmationManager.rescheduleInTransaction(HOST_ID, 10L, moved)).willReturn(rescheduled);

        // when
        Booking result = bookingService.rescheduleBooking(
                new RescheduleBookingCommand(HOST_ID, 10L, moved.start(), moved.end()));

        // then
        assertThat(result.interval()).isEqualTo(moved);
    }

    @Test
    @DisplayName("목록은 시작 시각 순으로 정렬")
    void listBookings_Sorted() {
        // given
        Instant from = Instant.parse("2026-03-02T00:00:00Z");
        Instant to = Instant.parse("2026-03-03T00:00:00Z");
        given(bookingRepository.findByHostBetween(HOST_ID, from, to)).willReturn(List.of(
                booking(2L, from.plusSeconds(7200)), booking(1L, from.plusSeconds(3600))));

        // when
        List<Booking> bookings = bookingService.listBookings(HOST_ID, from, to);

        // then
        assertThat(bookings).extracting(Booking::id).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("조회 범위의 끝이 시작보다 앞서면 입력 오류")
    void listBookings_InvalidRange() {
        Instant from = Instant.parse("2026-03-02T00:00:00Z");

        assertThatThrownBy(() -> bookingService.listBookings(HOST_ID, from, from))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_INPUT);
    }
}
