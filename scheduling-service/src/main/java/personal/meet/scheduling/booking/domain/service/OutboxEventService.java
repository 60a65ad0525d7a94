package personal.meet.scheduling.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.meet.scheduling.booking.application.port.in.PublishPendingEventsUseCase;
import personal.meet.scheduling.booking.application.port.out.BookingEventPublisher;
import personal.meet.scheduling.booking.application.port.out.OutboxEventRepository;
import personal.meet.scheduling.booking.domain.model.OutboxEvent;

import java.time.Clock;
import java.util.List;

/**
 * Outbox Event Service
 * 대기 중인 이벤트를 발행 처리하는 도메인 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService implements PublishPendingEventsUseCase {

    public static final String BOOKING_CONFIRMED = "BOOKING_CONFIRMED";
    public static final String BOOKING_CANCELLED = "BOOKING_CANCELLED";

    private final OutboxEventRepository outboxEventRepository;
    private final BookingEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPendingEvents();
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                String topic = mapEventTypeToTopic(event.eventType());

                // Key: bookingId 단위 순서 보장
                String key = String.valueOf(event.aggregateId());

                log.debug("Publishing event: id={}, type={}, topic={}", event.id(), event.eventType(), topic);
                eventPublisher.publishRaw(topic, key, event.payload());

                outboxEventRepository.save(event.markAsPublished(clock.instant()));
                publishedCount++;

            } catch (Exception e) {
                log.error("Failed to publish event: id={}, retryCount={}", event.id(), event.retryCount(), e);
                outboxEventRepository.save(event.recordFailure());
            }
        }
        return publishedCount;
    }

    private String mapEventTypeToTopic(String eventType) {
        return switch (eventType) {
            case BOOKING_CONFIRMED -> "booking.confirmed";
            case BOOKING_CANCELLED -> "booking.cancelled";
            default -> throw new IllegalArgumentException("Unknown event type: " + eventType);
        };
    }
}
