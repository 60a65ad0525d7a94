package personal.meet.scheduling.booking.application.port.out;

import personal.meet.scheduling.booking.domain.model.Booking;

/**
 * Notification Publisher (Output Port)
 * 예약 이벤트 발행. 호출자는 실패해도 예약을 되돌리지 않는다.
 */
public interface NotificationPublisher {

    void bookingConfirmed(Booking booking);

    void bookingCancelled(Booking booking);
}
