package personal.meet.scheduling.availability.domain.model;

import personal.meet.scheduling.availability.domain.exception.InvalidAvailabilityRuleException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Availability Rule Domain Model
 * 호스트의 요일별 예약 가능 시간대 (불변)
 *
 * @param id                규칙 ID
 * @param hostId            호스트 ID
 * @param dayOfWeek         0=일요일 .. 6=토요일
 * @param startTime         호스트 로컬 시작 시각
 * @param endTime           호스트 로컬 종료 시각
 * @param bufferMinutes     예약 전후 필수 공백 (분)
 * @param maxBookingsPerDay 하루 최대 예약 수 (null이면 제한 없음)
 */
public record AvailabilityRule(
        Long id,
        Long hostId,
        int dayOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        int bufferMinutes,
        Integer maxBookingsPerDay) {

    public static final int SUNDAY = 0;
    public static final int SATURDAY = 6;

    public AvailabilityRule {
        if (hostId == null) {
            throw new InvalidAvailabilityRuleException("Host ID cannot be null");
        }
        if (dayOfWeek < SUNDAY || dayOfWeek > SATURDAY) {
            throw new InvalidAvailabilityRuleException(
                    String.format("Day of week must be between 0 and 6: dayOfWeek=%d", dayOfWeek));
        }
        if (startTime == null || endTime == null) {
            throw new InvalidAvailabilityRuleException("Start and end time cannot be null");
        }
        if (!startTime.isBefore(endTime)) {
            throw new InvalidAvailabilityRuleException(
                    String.format("End time must be after start time: start=%s, end=%s", startTime, endTime));
        }
        if (bufferMinutes < 0) {
            throw new InvalidAvailabilityRuleException(
                    String.format("Buffer minutes cannot be negative: bufferMinutes=%d", bufferMinutes));
        }
        if (maxBookingsPerDay != null && maxBookingsPerDay <= 0) {
            throw new InvalidAvailabilityRuleException(
                    String.format("Max bookings per day must be positive: maxBookingsPerDay=%d", maxBookingsPerDay));
        }
    }

    /**
     * 규칙 생성 (정적 팩토리 메서드)
     */
    public static AvailabilityRule create(Long hostId, int dayOfWeek, LocalTime startTime, LocalTime endTime,
                                          int bufferMinutes, Integer maxBookingsPerDay) {
        return new AvailabilityRule(null, hostId, dayOfWeek, startTime, endTime, bufferMinutes, maxBookingsPerDay);
    }

    /**
     * 날짜의 요일 인덱스 (0=일요일 .. 6=토요일)
     */
    public static int dayIndexOf(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    /**
     * 부분 수정. null 인자는 기존 값을 유지한다.
     * 병합 결과도 동일한 불변식을 만족해야 한다.
     */
    public AvailabilityRule update(Integer newDayOfWeek, LocalTime newStartTime, LocalTime newEndTime,
                                   Integer newBufferMinutes, Integer newMaxBookingsPerDay,
                                   boolean clearMaxBookingsPerDay) {
        Integer mergedCap = clearMaxBookingsPerDay
                ? null
                : (newMaxBookingsPerDay != null ? newMaxBookingsPerDay : maxBookingsPerDay);
        return new AvailabilityRule(
                id,
                hostId,
                newDayOfWeek != null ? newDayOfWeek : dayOfWeek,
                newStartTime != null ? newStartTime : startTime,
                newEndTime != null ? newEndTime : endTime,
                newBufferMinutes != null ? newBufferMinutes : bufferMinutes,
                mergedCap);
    }

    public Duration buffer() {
        return Duration.ofMinutes(bufferMinutes);
    }

    public boolean hasDailyCap() {
        return maxBookingsPerDay != null;
    }
}
