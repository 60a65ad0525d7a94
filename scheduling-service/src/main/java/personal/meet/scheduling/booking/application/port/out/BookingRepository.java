package personal.meet.scheduling.booking.application.port.out;

import personal.meet.scheduling.booking.domain.model.Booking;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Booking Repository (Output Port)
 */
public interface BookingRepository {

    /**
     * [from, to)와 겹치는 CONFIRMED 예약
     */
    List<Booking> findConfirmedByHostBetween(Long hostId, Instant from, Instant to);

    /**
     * [from, to) 안에서 시작하는 예약 (상태 무관)
     */
    List<Booking> findByHostBetween(Long hostId, Instant from, Instant to);

    Optional<Booking> findById(Long bookingId);

    /**
     * CONFIRMED 예약 삽입. 저장소 제약 위반은 SlotConflictException으로 변환된다.
     */
    Booking insertConfirmed(Booking booking);

    Booking save(Booking booking);

    /**
     * 호스트의 예약 집합을 직렬화한 하나의 원자적 작업 단위에서 work 실행.
     * work가 예외를 던지면 내부의 모든 쓰기가 함께 롤백된다.
     *
     * @throws personal.meet.scheduling.host.domain.exception.HostNotFoundException 호스트가 존재하지 않을 때
     */
    <T> T runAtomic(Long hostId, Supplier<T> work);
}
