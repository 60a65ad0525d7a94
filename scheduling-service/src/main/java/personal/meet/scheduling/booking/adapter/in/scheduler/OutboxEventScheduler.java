package personal.meet.scheduling.booking.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.booking.application.port.in.PublishPendingEventsUseCase;

/**
 * Outbox Event Scheduler (Driving Adapter)
 * 주기적으로 PENDING 상태의 예약 이벤트를 Kafka로 릴레이
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduling.outbox.relay-enabled", havingValue = "true", matchIfMissing = true)
public class OutboxEventScheduler {

    private final PublishPendingEventsUseCase publishPendingEventsUseCase;

    /**
     * 이전 작업 완료 후 500ms 간격
     */
    @Scheduled(fixedDelayString = "${scheduling.outbox.relay-interval-ms:500}")
    public void schedulePublishing() {
        int publishedCount = publishPendingEventsUseCase.publishPendingEvents();
        if (publishedCount > 0) {
            log.debug("Scheduled publishing completed. Count: {}", publishedCount);
        }
    }
}
