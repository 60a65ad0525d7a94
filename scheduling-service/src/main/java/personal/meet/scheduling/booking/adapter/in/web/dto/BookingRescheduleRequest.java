package personal.meet.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.meet.scheduling.booking.application.port.in.RescheduleBookingCommand;

import java.time.Instant;

/**
 * 일정 변경 요청 DTO
 */
public record BookingRescheduleRequest(
        @NotNull(message = "시작 시각은 필수입니다.")
        Instant startTime,

        @NotNull(message = "종료 시각은 필수입니다.")
        Instant endTime
) {
    public RescheduleBookingCommand toCommand(Long hostId, Long bookingId) {
        return new RescheduleBookingCommand(hostId, bookingId, startTime, endTime);
    }
}
