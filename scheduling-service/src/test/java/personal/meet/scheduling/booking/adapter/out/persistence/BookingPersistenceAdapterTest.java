package personal.meet.scheduling.booking.adapter.out.persistence;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import personal.meet.scheduling.booking.domain.exception.SlotConflictException;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingStatus;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;
import personal.meet.scheduling.booking.domain.model.TimeInterval;
import personal.meet.scheduling.booking.domain.service.BookingConfirmationManager;
import personal.meet.scheduling.host.adapter.out.persistence.HostEntity;
import personal.meet.scheduling.host.adapter.out.persistence.JpaHostRepository;
import personal.meet.scheduling.host.domain.exception.HostNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Booking Persistence Adapter 통합 테스트
 * 실제 MySQL에서 호스트 행 잠금, 유니크 제약, 반열린 구간 조회를 검증
 * 스키마는 Flyway 마이그레이션(db/migration)으로 생성된다.
 */
@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=none")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({BookingPersistenceAdapter.class, BookingRequestPersistenceAdapter.class, BookingConfirmationManager.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("BookingPersistenceAdapter 통합 테스트 (MySQL)")
class BookingPersistenceAdapterTest {

    @Container
    @ServiceConnection
    static MySQLContainer<?> mysql = new MySQLContainer<>(DockerImageName.parse("mysql:8.0.36"))
            .withDatabaseName("meet_scheduling")
            .withUsername("test_user")
            .withPassword("test_password");

    private static final Instant START = Instant.parse("2026-03-02T01:00:00Z");
    private static final CustomerInfo CUSTOMER = CustomerInfo.of("Kim", "kim@example.com");

    @Autowired
    private BookingPersistenceAdapter bookingPersistenceAdapter;

    @Autowired
    private BookingConfirmationManager bookingConfirmationManager;

    @Autowired
    private JpaBookingRepository jpaBookingRepository;

    @Autowired
    private JpaHostRepository jpaHostRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long hostId;

    @BeforeEach
    void setUp() {
        hostId = jpaHostRepository.save(HostEntity.of("Host", "Asia/Seoul", 30)).getId();
    }

    @AfterEach
    void tearDown() {
        jpaBookingRepository.deleteAll();
        jpaHostRepository.deleteAll();
    }

    private Booking booking(Instant start, int minutes, Long requestId) {
        TimeInterval interval = TimeInterval.ofMinutes(start, minutes);
        return new Booking(null, hostId, interval.start(), interval.end(), BookingStatus.CONFIRMED,
                CUSTOMER, requestId, START.minusSeconds(86400));
    }

    @Test
    @DisplayName("마이그레이션이 예약 요청 유니크 제약과 호스트-시작 시각 인덱스를 만든다")
    void migration_CreatesBookingConstraints() {
        List<String> indexes = jdbcTemplate.queryForList(
                "SELECT DISTINCT index_name FROM information_schema.statistics "
                        + "WHERE table_schema = DATABASE() AND table_name = 'bookings'",
                String.class);

        assertThat(indexes).contains("uk_booking_request", "idx_booking_host_start");
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = DATABASE() "
                        + "AND table_name IN ('hosts', 'availability_rules', 'bookings', 'booking_requests', 'outbox_events')",
                Integer.class)).isEqualTo(5);
    }

    @Test
    @DisplayName("겹침 조회는 반열린 구간으로 판정하고 취소된 예약은 제외")
    void findConfirmedByHostBetween_HalfOpen() {
        // given
        bookingPersistenceAdapter.insertConfirmed(booking(START, 60, null));
        Booking cancelled = bookingPersistenceAdapter.insertConfirmed(booking(START.plusSeconds(7200), 60, null));
        bookingPersistenceAdapter.save(cancelled.cancel());

        // when
        List<Booking> touching = bookingPersistenceAdapter.findConfirmedByHostBetween(
                hostId, START.plusSeconds(3600), START.plusSeconds(10800));
        List<Booking> overlapping = bookingPersistenceAdapter.findConfirmedByHostBetween(
                hostId, START.plusSeconds(1800), START.plusSeconds(5400));

        // then
        assertThat(touching).isEmpty();
        assertThat(overlapping).hasSize(1);
    }

    @Test
    @DisplayName("같은 예약 요청으로 두 번 삽입하면 SlotConflictException")
    void insertConfirmed_DuplicateRequest() {
        // given
        bookingPersistenceAdapter.insertConfirmed(booking(START, 60, 42L));

        // when & then
        assertThatThrownBy(() -> bookingPersistenceAdapter.insertConfirmed(booking(START.plusSeconds(7200), 60, 42L)))
                .isInstanceOf(SlotConflictException.class);
    }

    @Test
    @DisplayName("존재하지 않는 호스트의 원자적 작업은 HostNotFoundException")
    void runAtomic_UnknownHost() {
        assertThatThrownBy(() -> bookingPersistenceAdapter.runAtomic(hostId + 1000, () -> "never"))
                .isInstanceOf(HostNotFoundException.class);
    }

    @Test
    @DisplayName("원자적 작업에서 예외가 나면 내부 쓰기는 롤백된다")
    void runAtomic_RollsBack() {
        // when
        assertThatThrownBy(() -> bookingPersistenceAdapter.runAtomic(hostId, () -> {
            bookingPersistenceAdapter.insertConfirmed(booking(START, 60, null));
            throw new SlotConflictException("forced");
        })).isInstanceOf(SlotConflictException.class);

        // then
        assertThat(jpaBookingRepository.count()).isZero();
    }

    @Test
    @DisplayName("겹치는 직접 예약을 동시에 만들면 하나만 저장된다")
    void concurrentCreate_OnlyOneCommitted() throws Exception {
        // given
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            Instant offset = START.plusSeconds(i * 60L);
            Callable<Boolean> task = () -> {
                start.await();
                try {
                    bookingConfirmationManager.createInTransaction(
                            Booking.confirmed(hostId, TimeInterval.ofMinutes(offset, 60), CUSTOMER, START));
                    return true;
                } catch (SlotConflictException e) {
                    return false;
                }
            };
            futures.add(executor.submit(task));
        }

        // when
        start.countDown();
        int succeeded = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(30, TimeUnit.SECONDS)) {
                succeeded++;
            }
        }
        executor.shutdown();

        // then
        assertThat(succeeded).isEqualTo(1);
        assertThat(bookingPersistenceAdapter.findConfirmedByHostBetween(hostId, Instant.EPOCH, START.plusSeconds(86400)))
                .hasSize(1);
    }
}
