package personal.meet.scheduling.booking.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.meet.scheduling.availability.domain.exception.InvalidSlotRequestException;
import personal.meet.scheduling.booking.application.port.in.CreateBookingRequestCommand;
import personal.meet.scheduling.booking.application.port.out.BookingRequestRepository;
import personal.meet.scheduling.booking.application.port.out.SlotVerificationPort;
import personal.meet.scheduling.booking.domain.exception.BookingRequestNotFoundException;
import personal.meet.scheduling.booking.domain.exception.InvalidBookingRequestStateException;
import personal.meet.scheduling.booking.domain.exception.SlotConflictException;
import personal.meet.scheduling.booking.domain.model.BookingRequest;
import personal.meet.scheduling.booking.domain.model.BookingRequestStatus;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;
import personal.meet.scheduling.booking.domain.model.TimeInterval;
import personal.meet.scheduling.booking.domain.service.BookingConfirmationManager;
import personal.meet.scheduling.config.SchedulingProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingRequestService 단위 테스트")
class BookingRequestServiceTest {

    private static final Long HOST_ID = 1L;
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final TimeInterval SLOT = TimeInterval.ofMinutes(Instant.parse("2026-03-02T01:00:00Z"), 60);
    private static final CustomerInfo CUSTOMER = CustomerInfo.of("Kim", "kim@example.com");

    @Mock
    private BookingRequestRepository bookingRequestRepository;

    @Mock
    private SlotVerificationPort slotVerificationPort;

    @Mock
    private BookingConfirmationManager bookingConfirmationManager;

    private BookingRequestService bookingRequestService;

    @BeforeEach
    void setUp() {
        bookingRequestService = new BookingRequestService(
                bookingRequestRepository,
                slotVerificationPort,
                bookingConfirmationManager,
                new SchedulingProperties(new SchedulingProperties.Slot(15, 240),
                        new SchedulingProperties.Request(30, 10)),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static BookingRequest stored(BookingRequestStatus status, Instant createdAt) {
        return new BookingRequest(3L, HOST_ID, SLOT.start(), SLOT.end(), CUSTOMER, "token-3", status,
                createdAt.plus(Duration.ofMinutes(30)), createdAt, null, null);
    }

    @Test
    @DisplayName("재검증을 통과하면 PENDING 요청을 만들고 점유 시간만큼 만료 시각을 둔다")
    void createRequest_Success() {
        // given
        given(slotVerificationPort.verifyBookable(HOST_ID, SLOT)).willReturn(false);
        given(bookingRequestRepository.save(any(BookingRequest.class))).willAnswer(inv -> inv.getArgument(0));

        // when
        BookingRequest created = bookingRequestService.createRequest(
                new CreateBookingRequestCommand(HOST_ID, SLOT, CUSTOMER));

        // then
        ArgumentCaptor<BookingRequest> captor = ArgumentCaptor.forClass(BookingRequest.class);
        then(bookingRequestRepository).should().save(captor.capture());
        BookingRequest saved = captor.getValue();
        assertThat(saved.status()).isEqualTo(BookingRequestStatus.PENDING);
        assertThat(saved.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
        assertThat(saved.confirmationToken()).isNotBlank();
        assertThat(created.interval()).isEqualTo(SLOT);
    }

    @Test
    @DisplayName("요청마다 서로 다른 확정 토큰을 발급한다")
    void createRequest_UniqueTokens() {
        // given
        given(slotVerificationPort.verifyBookable(HOST_ID, SLOT)).willReturn(true);
        given(bookingRequestRepository.save(any(BookingRequest.class))).willAnswer(inv -> inv.getArgument(0));
        CreateBookingRequestCommand command = new CreateBookingRequestCommand(HOST_ID, SLOT, CUSTOMER);

        // when
        BookingRequest first = bookingRequestService.createRequest(command);
        BookingRequest second = bookingRequestService.createRequest(command);

        // then
        assertThat(first.confirmationToken()).isNotEqualTo(second.confirmationToken());
    }

    @Test
    @DisplayName("슬롯이 이미 찼으면 요청을 저장하지 않는다")
    void createRequest_SlotTaken() {
        // given
        given(slotVerificationPort.verifyBookable(HOST_ID, SLOT)).willThrow(new SlotConflictException(HOST_ID, SLOT));

        // when & then
        assertThatThrownBy(() -> bookingRequestService.createRequest(
                new CreateBookingRequestCommand(HOST_ID, SLOT, CUSTOMER)))
                .isInstanceOf(SlotConflictException.class);
        then(bookingRequestRepository).should(never()).save(any());
    }

    @Test
    @DisplayName("가용 시간 밖의 요청은 검증 예외를 그대로 전달")
    void createRequest_OutsideAvailability() {
        // given
        given(slotVerificationPort.verifyBookable(HOST_ID, SLOT))
                .willThrow(InvalidSlotRequestException.outsideAvailability(HOST_ID, SLOT.start(), SLOT.end()));

        // when & then
        assertThatThrownBy(() -> bookingRequestService.createRequest(
                new CreateBookingRequestCommand(HOST_ID, SLOT, CUSTOMER)))
                .isInstanceOf(InvalidSlotRequestException.class);
    }

    @Test
    @DisplayName("만료 시각이 지난 요청은 조회 시 EXPIRED로 보이지만 저장하지 않는다")
    void getRequest_LazyExpiry() {
        // given
        given(bookingRequestRepository.findByToken("token-3"))
                .willReturn(Optional.of(stored(BookingRequestStatus.PENDING, NOW.minus(Duration.ofHours(1)))));

        // when
        BookingRequest seen = bookingRequestService.getRequest("token-3");

        // then
        assertThat(seen.status()).isEqualTo(BookingRequestStatus.EXPIRED);
        then(bookingRequestRepository).should(never()).save(any());
    }

    @Test
    @DisplayName("알 수 없는 토큰 조회는 실패")
    void getRequest_UnknownToken() {
        // given
        given(bookingRequestRepository.findByToken("nope")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> bookingRequestService.getRequest("nope"))
                .isInstanceOf(BookingRequestNotFoundException.class);
    }

    @Test
    @DisplayName("PENDING 요청 취소는 호스트 원자 작업 안에서 수행된다")
    void cancelRequest_Success() {
        // given
        BookingRequest pending = stored(BookingRequestStatus.PENDING, NOW.minusSeconds(60));
        given(bookingRequestRepository.findById(3L)).willReturn(Optional.of(pending));
        given(bookingConfirmationManager.cancelRequestInTransaction(HOST_ID, 3L, NOW)).willReturn(pending.cancel());

        // when
        BookingRequest cancelled = bookingRequestService.cancelRequest(3L);

        // then
        assertThat(cancelled.status()).isEqualTo(BookingRequestStatus.CANCELLED);
        then(bookingRequestRepository).should(never()).save(any());
    }

    @Test
    @DisplayName("만료된 요청 취소는 EXPIRED로 저장된 뒤 상태 오류")
    void cancelRequest_Expired() {
        // given
        BookingRequest pending = stored(BookingRequestStatus.PENDING, NOW.minus(Duration.ofHours(1)));
        given(bookingRequestRepository.findById(3L)).willReturn(Optional.of(pending));
        given(bookingConfirmationManager.cancelRequestInTransaction(HOST_ID, 3L, NOW)).willReturn(pending.expire());

        // when & then
        assertThatThrownBy(() -> bookingRequestService.cancelRequest(3L))
                .isInstanceOf(InvalidBookingRequestStateException.class)
                .hasMessageContaining("EXPIRED");
    }

    @Test
    @DisplayName("이미 확정된 요청은 취소할 수 없다")
    void cancelRequest_AlreadyConfirmed() {
        // given
        given(bookingRequestRepository.findById(3L))
                .willReturn(Optional.of(stored(BookingRequestStatus.CONFIRMED, NOW.minusSeconds(60))));

        // when & then
        assertThatThrownBy(() -> bookingRequestService.cancelRequest(3L))
                .isInstanceOf(InvalidBookingRequestStateException.class);
        then(bookingConfirmationManager).shouldHaveNoInteractions();
    }
}
