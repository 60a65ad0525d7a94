package personal.meet.scheduling.availability.adapter.out.external;

import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.time.Instant;
import java.util.List;

/**
 * 캘린더 동기화 서비스 busy 조회 응답
 */
public record CalendarBusyResponse(
        List<BusyBlock> busy
) {
    public record BusyBlock(
            Instant start,
            Instant end
    ) {}

    public List<TimeInterval> toIntervals() {
        if (busy == null) {
            return List.of();
        }
        return busy.stream()
                .map(block -> new TimeInterval(block.start(), block.end()))
                .toList();
    }
}
