package personal.meet.scheduling.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.meet.scheduling.booking.domain.model.BookingStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    /**
     * [from, to)와 겹치는 예약 (반열린 구간)
     */
    @Query("SELECT b FROM BookingEntity b " +
            "WHERE b.hostId = :hostId AND b.status = :status " +
            "AND b.startTime < :to AND b.endTime > :from " +
            "ORDER BY b.startTime")
    List<BookingEntity> findOverlapping(@Param("hostId") Long hostId,
                                        @Param("status") BookingStatus status,
                                        @Param("from") Instant from,
                                        @Param("to") Instant to);

    List<BookingEntity> findByHostIdAndStartTimeGreaterThanEqualAndStartTimeLessThanOrderByStartTimeAsc(
            Long hostId, Instant from, Instant to);

    /**
     * 호스트 행 비관적 잠금 (트랜잭션 종료 시 해제)
     * 같은 호스트의 예약 집합 변경을 직렬화한다.
     */
    @Query(value = "SELECT id FROM hosts WHERE id = :hostId FOR UPDATE", nativeQuery = true)
    Optional<Long> lockHostRow(@Param("hostId") Long hostId);
}
