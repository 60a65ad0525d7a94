package personal.meet.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduling Service Application
 * Host, Availability, Booking 도메인을 포함하는 예약 스케줄링 서비스
 */
@EnableScheduling  // Outbox Scheduler 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.meet.scheduling",
        "personal.meet.common"  // common 모듈의 GlobalExceptionHandler 스캔
    }
)
public class SchedulingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(SchedulingServiceApplication.class, args);
    }
}
