package personal.meet.scheduling.availability.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.meet.scheduling.availability.domain.model.AvailabilityRule;

import java.time.LocalTime;

/**
 * Availability Rule JPA Entity
 * 가용 시간 규칙 테이블 매핑
 */
@Entity
@Table(name = "availability_rules",
        indexes = @Index(name = "idx_rule_host_day", columnList = "host_id, day_of_week"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AvailabilityRuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "host_id", nullable = false)
    private Long hostId;

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "buffer_minutes", nullable = false)
    private int bufferMinutes;

    @Column(name = "max_bookings_per_day")
    private Integer maxBookingsPerDay;

    public static AvailabilityRuleEntity fromDomain(AvailabilityRule rule) {
        AvailabilityRuleEntity entity = new AvailabilityRuleEntity();
        entity.id = rule.id();
        entity.hostId = rule.hostId();
        entity.dayOfWeek = rule.dayOfWeek();
        entity.startTime = rule.startTime();
        entity.endTime = rule.endTime();
        entity.bufferMinutes = rule.bufferMinutes();
        entity.maxBookingsPerDay = rule.maxBookingsPerDay();
        return entity;
    }

    public AvailabilityRule toDomain() {
        return new AvailabilityRule(id, hostId, dayOfWeek, startTime, endTime, bufferMinutes, maxBookingsPerDay);
    }
}
