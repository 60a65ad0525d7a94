package personal.meet.scheduling.booking.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.meet.common.exception.BusinessException;
import personal.meet.scheduling.booking.domain.exception.SlotConflictException;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingRequest;
import personal.meet.scheduling.booking.domain.model.BookingRequestStatus;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;
import personal.meet.scheduling.booking.domain.model.TimeInterval;
import personal.meet.scheduling.booking.domain.service.BookingConfirmationManager;
import personal.meet.scheduling.booking.domain.service.ConflictChecker;
import personal.meet.scheduling.config.SchedulingProperties;
import personal.meet.scheduling.support.InMemoryBookingRepository;
import personal.meet.scheduling.support.InMemoryBookingRequestRepository;
import personal.meet.scheduling.support.InMemoryConfirmationLockRepository;
import personal.meet.scheduling.support.RecordingNotificationPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 같은 호스트의 겹치는 요청을 동시에 확정할 때 정확히 하나만 성공하는지 반복 검증
 */
@DisplayName("동시 확정 경쟁 테스트")
class ConcurrentConfirmationTest {

    private static final int TRIALS = 1_000;
    private static final Long HOST_ID = 1L;
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final Instant SLOT_START = Instant.parse("2026-03-02T01:00:00Z");
    private static final SchedulingProperties PROPERTIES = new SchedulingProperties(
            new SchedulingProperties.Slot(15, 240), new SchedulingProperties.Request(30, 10));

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("같은 슬롯에 대한 두 요청을 동시에 확정하면 하나만 성공하고 나머지는 EXPIRED")
    void identicalSlots_ExactlyOneWins() throws Exception {
        for (int trial = 0; trial < TRIALS; trial++) {
            runTrial(TimeInterval.ofMinutes(SLOT_START, 60), TimeInterval.ofMinutes(SLOT_START, 60));
        }
    }

    @Test
    @DisplayName("일부만 겹치는 두 요청도 하나만 성공한다")
    void partiallyOverlappingSlots_ExactlyOneWins() throws Exception {
        for (int trial = 0; trial < TRIALS; trial++) {
            runTrial(TimeInterval.ofMinutes(SLOT_START, 60),
                    TimeInterval.ofMinutes(SLOT_START.plus(Duration.ofMinutes(30)), 60));
        }
    }

    @Test
    @DisplayName("맞닿은 두 요청은 모두 확정된다")
    void adjacentSlots_BothConfirmed() throws Exception {
        Fixture fixture = new Fixture();
        BookingRequest first = fixture.pending(TimeInterval.ofMinutes(SLOT_START, 60), "a");
        BookingRequest second = fixture.pending(TimeInterval.ofMinutes(SLOT_START.plus(Duration.ofMinutes(60)), 60), "b");

        List<Object> outcomes = race(fixture, first, second);

        assertThat(outcomes).allMatch(Booking.class::isInstance);
        assertThat(fixture.bookings.confirmedBookings(HOST_ID)).hasSize(2);
    }

    @Test
    @DisplayName("같은 토큰으로 동시에 확정해도 예약은 하나만 생긴다")
    void sameToken_SingleBooking() throws Exception {
        for (int trial = 0; trial < 200; trial++) {
            Fixture fixture = new Fixture();
            BookingRequest request = fixture.pending(TimeInterval.ofMinutes(SLOT_START, 60), "same");

            List<Object> outcomes = race(fixture, request, request);

            assertThat(outcomes).filteredOn(Booking.class::isInstance).hasSize(1);
            assertThat(outcomes).filteredOn(o -> !(o instanceof Booking))
                    .allMatch(BusinessException.class::isInstance);
            assertThat(fixture.bookings.confirmedBookings(HOST_ID)).hasSize(1);
            assertThat(fixture.requests.findById(request.id()).orElseThrow().status())
                    .isEqualTo(BookingRequestStatus.CONFIRMED);
        }
    }

    private void runTrial(TimeInterval firstSlot, TimeInterval secondSlot) throws Exception {
        Fixture fixture = new Fixture();
        BookingRequest first = fixture.pending(firstSlot, "first");
        BookingRequest second = fixture.pending(secondSlot, "second");

        List<Object> outcomes = race(fixture, first, second);

        assertThat(outcomes).filteredOn(Booking.class::isInstance).hasSize(1);
        assertThat(outcomes).filteredOn(SlotConflictException.class::isInstance).hasSize(1);

        List<Booking> confirmed = fixture.bookings.confirmedBookings(HOST_ID);
        assertThat(confirmed).hasSize(1);
        for (int i = 0; i < confirmed.size(); i++) {
            for (int j = i + 1; j < confirmed.size(); j++) {
                assertThat(ConflictChecker.overlaps(confirmed.get(i).interval(), confirmed.get(j).interval()))
                        .isFalse();
            }
        }

        List<BookingRequestStatus> statuses = List.of(
                fixture.requests.findById(first.id()).orElseThrow().status(),
                fixture.requests.findById(second.id()).orElseThrow().status());
        assertThat(statuses).containsExactlyInAnyOrder(BookingRequestStatus.CONFIRMED, BookingRequestStatus.EXPIRED);
        assertThat(fixture.notifications.confirmed()).hasSize(1);
    }

    private List<Object> race(Fixture fixture, BookingRequest first, BookingRequest second)
            throws InterruptedException, ExecutionException {
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<Object>> futures = new ArrayList<>();
        for (BookingRequest request : List.of(first, second)) {
            Callable<Object> task = () -> {
                ready.countDown();
                start.await();
                try {
                    return fixture.confirmService.confirmRequest(request.confirmationToken());
                } catch (BusinessException e) {
                    return e;
                }
            };
            futures.add(executor.submit(task));
        }

        ready.await();
        start.countDown();

        List<Object> outcomes = new ArrayList<>();
        for (Future<Object> future : futures) {
            try {
                outcomes.add(future.get(10, TimeUnit.SECONDS));
            } catch (TimeoutException e) {
                throw new IllegalStateException("Confirmation did not finish", e);
            }
        }
        return outcomes;
    }

    private static class Fixture {
        final InMemoryBookingRepository bookings = new InMemoryBookingRepository(HOST_ID);
        final InMemoryBookingRequestRepository requests = new InMemoryBookingRequestRepository();
        final RecordingNotificationPublisher notifications = new RecordingNotificationPublisher();
        final BookingConfirmService confirmService = new BookingConfirmService(
                requests,
                new InMemoryConfirmationLockRepository(),
                new BookingConfirmationManager(bookings, requests),
                notifications,
                PROPERTIES,
                Clock.fixed(NOW, ZoneOffset.UTC),
                new SimpleMeterRegistry());

        BookingRequest pending(TimeInterval slot, String token) {
            return requests.save(BookingRequest.create(HOST_ID, slot, CustomerInfo.of("Guest " + token,
                    token + "@example.com"), token, NOW, PROPERTIES.request().holdWindow()));
        }
    }
}
