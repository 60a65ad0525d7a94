package personal.meet.scheduling.availability.domain.model;

import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.time.Instant;

/**
 * Slot
 * 아직 확정되지 않은 예약 후보 구간
 */
public record Slot(Instant start, Instant end) implements Comparable<Slot> {

    public static Slot of(TimeInterval interval) {
        return new Slot(interval.start(), interval.end());
    }

    public TimeInterval toInterval() {
        return new TimeInterval(start, end);
    }

    @Override
    public int compareTo(Slot other) {
        int byStart = start.compareTo(other.start);
        return byStart != 0 ? byStart : end.compareTo(other.end);
    }
}
