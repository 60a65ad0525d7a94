package personal.meet.scheduling.availability.domain.model;

import personal.meet.scheduling.booking.domain.model.TimeInterval;
import personal.meet.scheduling.booking.domain.service.ConflictChecker;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Day Schedule
 * 호스트 로컬 날짜 하루에 대한 슬롯 계산 입력의 스냅샷.
 * 규칙 창을 슬롯으로 타일링하고, 버퍼를 적용한 그림자 구간으로 점유 구간과의 겹침을 판정한다.
 *
 * @param date            호스트 로컬 날짜
 * @param zone            호스트 타임존
 * @param rules           해당 요일의 규칙 (시작 시각 순)
 * @param bookedIntervals 확정 예약 구간
 * @param busyIntervals   외부 캘린더 busy 구간
 * @param partial         외부 캘린더 정보를 가져오지 못했는지 여부
 */
public record DaySchedule(
        LocalDate date,
        ZoneId zone,
        List<AvailabilityRule> rules,
        List<TimeInterval> bookedIntervals,
        List<TimeInterval> busyIntervals,
        boolean partial) {

    public DaySchedule {
        rules = rules.stream()
                .sorted(Comparator.comparing(AvailabilityRule::startTime))
                .toList();
        bookedIntervals = List.copyOf(bookedIntervals);
        busyIntervals = List.copyOf(busyIntervals);
    }

    public Instant dayStart() {
        return date.atStartOfDay(zone).toInstant();
    }

    public Instant dayEnd() {
        return date.plusDays(1).atStartOfDay(zone).toInstant();
    }

    /**
     * 점유 구간을 조회할 범위. 규칙 중 가장 큰 버퍼만큼 하루 경계를 넓힌다.
     */
    public static TimeInterval lookupRange(LocalDate date, ZoneId zone, List<AvailabilityRule> rules) {
        Duration widest = Duration.ofMinutes(rules.stream()
                .mapToInt(AvailabilityRule::bufferMinutes)
                .max()
                .orElse(0));
        return new TimeInterval(
                date.atStartOfDay(zone).toInstant().minus(widest),
                date.plusDays(1).atStartOfDay(zone).toInstant().plus(widest));
    }

    /**
     * 하루 최대 예약 수. 여러 규칙이 있으면 가장 작은 값.
     */
    public OptionalInt dailyCap() {
        return rules.stream()
                .filter(AvailabilityRule::hasDailyCap)
                .mapToInt(AvailabilityRule::maxBookingsPerDay)
                .min();
    }

    /**
     * 호스트 로컬 날짜에 시작하는 확정 예약 수
     */
    public long bookingsOnDay() {
        Instant from = dayStart();
        Instant to = dayEnd();
        return bookedIntervals.stream()
                .filter(b -> !b.start().isBefore(from) && b.start().isBefore(to))
                .count();
    }

    public boolean isSaturated() {
        OptionalInt cap = dailyCap();
        return cap.isPresent() && bookingsOnDay() >= cap.getAsInt();
    }

    /**
     * 규칙 창을 durationMinutes 간격으로 타일링한 뒤 점유 구간과 겹치지 않는 슬롯만 반환.
     * now 이전 또는 같은 시각에 시작하는 슬롯은 제외한다.
     */
    public List<Slot> openSlots(int durationMinutes, Instant now) {
        if (isSaturated()) {
            return List.of();
        }
        TreeSet<Slot> slots = new TreeSet<>();
        for (AvailabilityRule rule : rules) {
            for (TimeInterval candidate : tile(rule, durationMinutes)) {
                if (candidate.start().isAfter(now) && isFree(candidate, rule)) {
                    slots.add(Slot.of(candidate));
                }
            }
        }
        return new ArrayList<>(slots);
    }

    /**
     * interval을 완전히 포함하는 규칙 창
     */
    public List<AvailabilityRule> rulesEnclosing(TimeInterval interval) {
        return rules.stream()
                .filter(rule -> window(rule).encloses(interval))
                .toList();
    }

    /**
     * 규칙의 버퍼를 적용한 그림자 구간이 확정 예약, 외부 busy 구간과 겹치지 않는지
     */
    public boolean isFree(TimeInterval interval, AvailabilityRule rule) {
        TimeInterval shadow = interval.expand(rule.buffer());
        return !ConflictChecker.anyOverlap(shadow, bookedIntervals)
                && !ConflictChecker.anyOverlap(shadow, busyIntervals);
    }

    public Optional<AvailabilityRule> firstFreeEnclosingRule(TimeInterval interval) {
        return rulesEnclosing(interval).stream()
                .filter(rule -> isFree(interval, rule))
                .findFirst();
    }

    TimeInterval window(AvailabilityRule rule) {
        return new TimeInterval(
                date.atTime(rule.startTime()).atZone(zone).toInstant(),
                date.atTime(rule.endTime()).atZone(zone).toInstant());
    }

    /**
     * 창 시작을 한 번만 instant로 해석한 뒤 instant 축에서 durationMinutes씩 전진한다.
     * DST 전환일에도 모든 슬롯 길이는 정확히 durationMinutes다.
     */
    List<TimeInterval> tile(AvailabilityRule rule, int durationMinutes) {
        Duration length = Duration.ofMinutes(durationMinutes);
        TimeInterval window = window(rule);
        List<TimeInterval> candidates = new ArrayList<>();
        Instant start = window.start();
        while (!start.plus(length).isAfter(window.end())) {
            candidates.add(new TimeInterval(start, start.plus(length)));
            start = start.plus(length);
        }
        return candidates;
    }
}
