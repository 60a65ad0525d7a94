package personal.meet.scheduling.booking.domain.model;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;

/**
 * Time Interval
 * 반열린 구간 [start, end). 예약, 슬롯, 외부 캘린더 busy 구간 모두 이 타입으로 표현한다.
 */
public record TimeInterval(Instant start, Instant end) {

    public TimeInterval {
        if (start == null || end == null) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TIME, "Interval bounds cannot be null");
        }
        if (end.isBefore(start)) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_TIME,
                    String.format("Interval end must not precede start: start=%s, end=%s", start, end));
        }
    }

    public static TimeInterval of(Instant start, Instant end) {
        return new TimeInterval(start, end);
    }

    public static TimeInterval ofMinutes(Instant start, long minutes) {
        return new TimeInterval(start, start.plus(Duration.ofMinutes(minutes)));
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /**
     * 버퍼만큼 양쪽으로 확장한 그림자 구간
     */
    public TimeInterval expand(Duration buffer) {
        if (buffer.isZero()) {
            return this;
        }
        return new TimeInterval(start.minus(buffer), end.plus(buffer));
    }

    /**
     * other가 이 구간 안에 완전히 포함되는지 여부
     */
    public boolean encloses(TimeInterval other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }
}
