package personal.meet.scheduling.availability.application.port.out;

import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.time.Instant;
import java.util.List;

/**
 * External Busy Provider (Output Port)
 * 연결된 외부 캘린더의 busy 구간 조회
 */
public interface ExternalBusyProvider {

    /**
     * @throws personal.meet.scheduling.availability.domain.exception.CalendarUnavailableException
     *         외부 캘린더 서비스에 일시적으로 연결할 수 없을 때
     */
    List<TimeInterval> getBusyIntervals(Long hostId, Instant rangeStart, Instant rangeEnd);
}
