package personal.meet.scheduling.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import personal.meet.scheduling.booking.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.List;

/**
 * Spring Data JPA Repository for OutboxEvent
 */
public interface JpaOutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    /**
     * 발행 대기 중인 이벤트 조회 (재시도 횟수 제한)
     */
    List<OutboxEventEntity> findTop100ByStatusAndRetryCountLessThanOrderByCreatedAtAsc(
            OutboxEventStatus status,
            int maxRetryCount
    );
}
