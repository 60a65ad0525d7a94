package personal.meet.scheduling.booking.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.meet.scheduling.booking.application.port.out.NotificationPublisher;
import personal.meet.scheduling.booking.application.port.out.OutboxEventRepository;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.service.OutboxEventService;

import java.time.Clock;

/**
 * Booking Notification Adapter
 * Outbox 패턴을 사용한 예약 이벤트 발행 구현체.
 * 예약 커밋 이후 별도 트랜잭션으로 Outbox 행을 기록하고, Kafka 릴레이는 OutboxEventScheduler가 담당한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingNotificationAdapter implements NotificationPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;
    private final Clock clock;

    @Override
    @Transactional
    public void bookingConfirmed(Booking booking) {
        record(booking, OutboxEventService.BOOKING_CONFIRMED);
    }

    @Override
    @Transactional
    public void bookingCancelled(Booking booking) {
        record(booking, OutboxEventService.BOOKING_CANCELLED);
    }

    private void record(Booking booking, String eventType) {
        outboxEventRepository.save(outboxEventFactory.create(booking, eventType, clock.instant()));
        log.debug("Booking event recorded: bookingId={}, eventType={}", booking.id(), eventType);
    }
}
