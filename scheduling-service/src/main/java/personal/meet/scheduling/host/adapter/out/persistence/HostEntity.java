package personal.meet.scheduling.host.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.meet.scheduling.host.domain.model.Host;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Host JPA Entity
 * 호스트 테이블 매핑. 예약 확정 시 호스트 단위 행 잠금의 대상이기도 하다.
 */
@Entity
@Table(name = "hosts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class HostEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 64)
    private String timezone;

    @Column(name = "booking_horizon_days", nullable = false)
    private int bookingHorizonDays;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * 정적 팩토리 메서드 (테스트용)
     */
    public static HostEntity of(String name, String timezone, int bookingHorizonDays) {
        HostEntity entity = new HostEntity();
        entity.name = name;
        entity.timezone = timezone;
        entity.bookingHorizonDays = bookingHorizonDays;
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * 도메인 모델로 변환
     */
    public Host toDomain() {
        return new Host(id, name, ZoneId.of(timezone), bookingHorizonDays);
    }
}
