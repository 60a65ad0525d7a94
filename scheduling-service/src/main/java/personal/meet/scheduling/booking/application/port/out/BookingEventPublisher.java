package personal.meet.scheduling.booking.application.port.out;

/**
 * Booking Event Publisher (Output Port)
 * Kafka 이벤트 발행 인터페이스
 */
public interface BookingEventPublisher {

    /**
     * 이미 직렬화된 JSON Payload를 그대로 발행.
     * 브로커 확인까지 기다리며 실패 시 예외를 던진다.
     *
     * @param topic   발행할 Kafka 토픽
     * @param key     메시지 키 (순서 보장용, bookingId)
     * @param payload 메시지 본문 (JSON String)
     */
    void publishRaw(String topic, String key, String payload);
}
