package personal.meet.scheduling.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Scheduling 설정 Properties
 * application.yml의 scheduling.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "scheduling")
public record SchedulingProperties(
        Slot slot,
        Request request
) {
    public record Slot(
            int minDurationMinutes,
            int maxDurationMinutes
    ) {}

    public record Request(
            int holdWindowMinutes,          // PENDING 요청이 슬롯을 점유하는 시간
            int confirmationLockTtlSeconds  // 확정 중복 방지 Redis 락 TTL
    ) {
        public Duration holdWindow() {
            return Duration.ofMinutes(holdWindowMinutes);
        }

        public Duration confirmationLockTtl() {
            return Duration.ofSeconds(confirmationLockTtlSeconds);
        }
    }
}
