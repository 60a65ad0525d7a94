package personal.meet.scheduling.booking.application.port.in;

import personal.meet.scheduling.booking.domain.model.Booking;

/**
 * Reschedule Booking UseCase (Input Port)
 */
public interface RescheduleBookingUseCase {

    /**
     * 다른 확정 예약과 겹치지 않을 때만 시간 변경
     *
     * @throws personal.meet.scheduling.booking.domain.exception.SlotConflictException 겹칠 때
     */
    Booking rescheduleBooking(RescheduleBookingCommand command);
}
