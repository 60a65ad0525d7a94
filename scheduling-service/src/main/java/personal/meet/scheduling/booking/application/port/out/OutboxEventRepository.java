package personal.meet.scheduling.booking.application.port.out;

import personal.meet.scheduling.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Repository (Output Port)
 * Transactional Outbox Pattern을 위한 이벤트 저장소 인터페이스
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * @return PENDING 상태이고 재시도 한도 미만인 이벤트 (생성 순)
     */
    List<OutboxEvent> findPendingEvents();
}
