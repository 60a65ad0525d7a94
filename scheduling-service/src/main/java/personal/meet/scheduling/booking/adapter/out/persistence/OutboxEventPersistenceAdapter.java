package personal.meet.scheduling.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.booking.application.port.out.OutboxEventRepository;
import personal.meet.scheduling.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Persistence Adapter
 * OutboxEventRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        return jpaOutboxEventRepository.save(OutboxEventEntity.fromDomain(outboxEvent)).toDomain();
    }

    @Override
    public List<OutboxEvent> findPendingEvents() {
        return jpaOutboxEventRepository.findTop100ByStatusAndRetryCountLessThanOrderByCreatedAtAsc(
                        OutboxEvent.OutboxEventStatus.PENDING,
                        OutboxEvent.MAX_RETRY_COUNT)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }
}
