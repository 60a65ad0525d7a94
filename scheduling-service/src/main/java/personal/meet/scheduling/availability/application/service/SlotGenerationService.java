package personal.meet.scheduling.availability.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.meet.scheduling.availability.application.port.in.GenerateSlotsUseCase;
import personal.meet.scheduling.availability.application.port.in.VerifySlotUseCase;
import personal.meet.scheduling.availability.application.port.out.AccountDirectory;
import personal.meet.scheduling.availability.application.port.out.AvailabilityRuleRepository;
import personal.meet.scheduling.availability.application.port.out.BookedTimeQueryPort;
import personal.meet.scheduling.availability.application.port.out.ExternalBusyProvider;
import personal.meet.scheduling.availability.domain.exception.CalendarUnavailableException;
import personal.meet.scheduling.availability.domain.exception.InvalidSlotRequestException;
import personal.meet.scheduling.availability.domain.model.AvailabilityRule;
import personal.meet.scheduling.availability.domain.model.DaySchedule;
import personal.meet.scheduling.availability.domain.model.Slot;
import personal.meet.scheduling.availability.domain.model.SlotAvailability;
import personal.meet.scheduling.booking.domain.exception.SlotConflictException;
import personal.meet.scheduling.booking.domain.model.TimeInterval;
import personal.meet.scheduling.config.SchedulingProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Slot Generation Service
 * 규칙 창 - 확정 예약 - 외부 busy 구간으로 예약 가능 슬롯을 계산한다.
 *
 * <p>외부 캘린더 실패는 치명적이지 않다. 내부 예약만으로 계산하고 partial=true로 표시한다.
 * 이중 예약 방지는 확정 시점의 원자적 재검사가 보장하므로 여기서는 best-effort.
 */
@Slf4j
@Service
public class SlotGenerationService implements GenerateSlotsUseCase, VerifySlotUseCase {

    private final AccountDirectory accountDirectory;
    private final AvailabilityRuleRepository availabilityRuleRepository;
    private final BookedTimeQueryPort bookedTimeQueryPort;
    private final ExternalBusyProvider externalBusyProvider;
    private final SchedulingProperties properties;
    private final Clock clock;
    private final Counter degradedCounter;

    public SlotGenerationService(AccountDirectory accountDirectory,
                                 AvailabilityRuleRepository availabilityRuleRepository,
                                 BookedTimeQueryPort bookedTimeQueryPort,
                                 ExternalBusyProvider externalBusyProvider,
                                 SchedulingProperties properties,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.accountDirectory = accountDirectory;
        this.availabilityRuleRepository = availabilityRuleRepository;
        this.bookedTimeQueryPort = bookedTimeQueryPort;
        this.externalBusyProvider = externalBusyProvider;
        this.properties = properties;
        this.clock = clock;
        this.degradedCounter = Counter.builder("scheduling.slots.degraded")
                .description("Slot computations without external calendar data")
                .register(meterRegistry);
    }

    @Override
    public SlotAvailability generateSlots(Long hostId, LocalDate date, int durationMinutes) {
        validateDuration(durationMinutes);

        ZoneId zone = accountDirectory.getHostTimezone(hostId);
        Instant now = clock.instant();
        validateDate(hostId, date, zone, now);

        DaySchedule schedule = loadDaySchedule(hostId, date, zone);
        if (schedule.rules().isEmpty()) {
            log.debug("No availability rules: hostId={}, date={}", hostId, date);
            return SlotAvailability.empty(hostId, date, durationMinutes, false);
        }
        if (schedule.isSaturated()) {
            log.debug("Day saturated: hostId={}, date={}, bookings={}, cap={}",
                    hostId, date, schedule.bookingsOnDay(), schedule.dailyCap().getAsInt());
            return SlotAvailability.empty(hostId, date, durationMinutes, schedule.partial());
        }

        List<Slot> slots = schedule.openSlots(durationMinutes, now);
        log.debug("Slots generated: hostId={}, date={}, duration={}, count={}, partial={}",
                hostId, date, durationMinutes, slots.size(), schedule.partial());
        return new SlotAvailability(hostId, date, durationMinutes, slots, schedule.partial());
    }

    @Override
    public boolean verifyBookable(Long hostId, TimeInterval interval) {
        validateDuration(interval.duration().toMinutes());

        ZoneId zone = accountDirectory.getHostTimezone(hostId);
        Instant now = clock.instant();
        LocalDate date = LocalDate.ofInstant(interval.start(), zone);
        validateDate(hostId, date, zone, now);
        if (!interval.start().isAfter(now)) {
            throw InvalidSlotRequestException.dateOutOfRange(
                    String.format("Requested start is not in the future: start=%s", interval.start()));
        }

        DaySchedule schedule = loadDaySchedule(hostId, date, zone);
        if (schedule.rulesEnclosing(interval).isEmpty()) {
            throw InvalidSlotRequestException.outsideAvailability(hostId, interval.start(), interval.end());
        }
        if (schedule.isSaturated()) {
            log.warn("Day saturated: hostId={}, date={}", hostId, date);
            throw new SlotConflictException(
                    String.format("Daily booking limit reached: hostId=%d, date=%s", hostId, date));
        }
        if (schedule.firstFreeEnclosingRule(interval).isEmpty()) {
            log.warn("Slot no longer free: hostId={}, start={}, end={}", hostId, interval.start(), interval.end());
            throw new SlotConflictException(hostId, interval);
        }
        return schedule.partial();
    }

    private DaySchedule loadDaySchedule(Long hostId, LocalDate date, ZoneId zone) {
        List<AvailabilityRule> rules =
                availabilityRuleRepository.findByHostIdAndDayOfWeek(hostId, AvailabilityRule.dayIndexOf(date));
        if (rules.isEmpty()) {
            return new DaySchedule(date, zone, rules, List.of(), List.of(), false);
        }

        TimeInterval range = DaySchedule.lookupRange(date, zone, rules);
        List<TimeInterval> booked = bookedTimeQueryPort.findConfirmedIntervals(hostId, range);

        List<TimeInterval> busy;
        boolean partial = false;
        try {
            busy = externalBusyProvider.getBusyIntervals(hostId, range.start(), range.end());
        } catch (CalendarUnavailableException e) {
            log.warn("External calendar unavailable, computing slots from internal bookings only: hostId={}, date={}",
                    hostId, date);
            degradedCounter.increment();
            busy = List.of();
            partial = true;
        }
        return new DaySchedule(date, zone, rules, booked, busy, partial);
    }

    private void validateDuration(long durationMinutes) {
        SchedulingProperties.Slot bounds = properties.slot();
        if (durationMinutes < bounds.minDurationMinutes() || durationMinutes > bounds.maxDurationMinutes()) {
            throw InvalidSlotRequestException.durationOutOfRange(
                    durationMinutes, bounds.minDurationMinutes(), bounds.maxDurationMinutes());
        }
    }

    private void validateDate(Long hostId, LocalDate date, ZoneId zone, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        if (date.isBefore(today)) {
            throw InvalidSlotRequestException.dateOutOfRange(
                    String.format("Date is in the past: date=%s, today=%s", date, today));
        }
        int horizonDays = accountDirectory.getBookingHorizonDays(hostId);
        LocalDate lastBookable = today.plusDays(horizonDays);
        if (date.isAfter(lastBookable)) {
            throw InvalidSlotRequestException.dateOutOfRange(
                    String.format("Date is beyond booking horizon: date=%s, lastBookable=%s", date, lastBookable));
        }
    }
}
