package personal.meet.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import personal.meet.scheduling.booking.application.port.in.CreateBookingCommand;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;

import java.time.Instant;

/**
 * 호스트 직접 예약 생성 DTO
 */
public record BookingCreateRequest(
        @NotNull(message = "시작 시각은 필수입니다.")
        Instant startTime,

        @NotNull(message = "종료 시각은 필수입니다.")
        Instant endTime,

        @NotBlank(message = "고객 이름은 필수입니다.")
        String customerName,

        @NotBlank(message = "고객 이메일은 필수입니다.")
        @Email(message = "이메일 형식이 올바르지 않습니다.")
        String customerEmail,

        String customerPhone,

        String notes
) {
    public CreateBookingCommand toCommand(Long hostId) {
        return new CreateBookingCommand(hostId, startTime, endTime,
                new CustomerInfo(customerName, customerEmail, customerPhone, notes));
    }
}
