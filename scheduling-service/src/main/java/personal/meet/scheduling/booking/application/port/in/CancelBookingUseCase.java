package personal.meet.scheduling.booking.application.port.in;

import personal.meet.scheduling.booking.domain.model.Booking;

/**
 * Cancel Booking UseCase (Input Port)
 * 취소된 예약은 삭제하지 않고 보관하며 겹침 검사에서 제외된다.
 */
public interface CancelBookingUseCase {

    Booking cancelBooking(Long hostId, Long bookingId);
}
