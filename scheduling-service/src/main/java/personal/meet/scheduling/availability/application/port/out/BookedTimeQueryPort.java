package personal.meet.scheduling.availability.application.port.out;

import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.util.List;

/**
 * Booked Time Query Port (Output Port)
 * Booking 도메인에서 호스트의 확정 예약 구간을 가져온다.
 */
public interface BookedTimeQueryPort {

    /**
     * range와 겹치는 CONFIRMED 예약 구간
     */
    List<TimeInterval> findConfirmedIntervals(Long hostId, TimeInterval range);
}
