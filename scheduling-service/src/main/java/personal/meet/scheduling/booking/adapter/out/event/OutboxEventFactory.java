package personal.meet.scheduling.booking.adapter.out.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.OutboxEvent;

import java.time.Instant;

/**
 * Outbox Event Factory (Adapter Layer)
 * Booking을 직렬화된 OutboxEvent로 변환하는 팩토리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    static final String AGGREGATE_TYPE = "BOOKING";

    private final ObjectMapper objectMapper;

    public OutboxEvent create(Booking booking, String eventType, Instant now) {
        try {
            BookingEvent event = new BookingEvent(
                    booking.id(),
                    booking.hostId(),
                    booking.bookingRequestId(),
                    booking.status().name(),
                    booking.startTime().toString(),
                    booking.endTime().toString(),
                    booking.customer().name(),
                    booking.customer().email(),
                    now.toString());

            String payload = objectMapper.writeValueAsString(event);

            return OutboxEvent.create(AGGREGATE_TYPE, booking.id(), eventType, payload, now);
        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: bookingId={}, eventType={}", booking.id(), eventType, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event", e);
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record BookingEvent(
            Long bookingId,
            Long hostId,
            Long bookingRequestId,
            String status,
            String startTime,
            String endTime,
            String customerName,
            String customerEmail,
            String occurredAt) {
    }
}
