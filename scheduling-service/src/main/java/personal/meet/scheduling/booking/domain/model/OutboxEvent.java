package personal.meet.scheduling.booking.domain.model;

import java.time.Instant;

/**
 * Outbox Event Domain Model
 * Transactional Outbox Pattern: Kafka로 릴레이될 예약 이벤트 (불변)
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        Instant createdAt,
        Instant publishedAt,
        int retryCount) {

    public static final int MAX_RETRY_COUNT = 3;

    public static OutboxEvent create(String aggregateType, Long aggregateId, String eventType,
                                     String payload, Instant now) {
        return new OutboxEvent(null, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PENDING, now, null, 0);
    }

    public OutboxEvent markAsPublished(Instant now) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, now, retryCount);
    }

    /**
     * 발행 실패 시 재시도 횟수 증가. 한도에 도달하면 FAILED.
     */
    public OutboxEvent recordFailure() {
        int retried = retryCount + 1;
        OutboxEventStatus next = retried >= MAX_RETRY_COUNT ? OutboxEventStatus.FAILED : OutboxEventStatus.PENDING;
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                next, createdAt, publishedAt, retried);
    }

    public enum OutboxEventStatus {
        PENDING,    // 발행 대기
        PUBLISHED,  // 발행 완료
        FAILED      // 발행 실패
    }
}
