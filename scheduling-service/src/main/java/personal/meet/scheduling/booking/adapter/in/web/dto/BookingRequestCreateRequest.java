package personal.meet.scheduling.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.meet.scheduling.booking.application.port.in.CreateBookingRequestCommand;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;
import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.time.Instant;

/**
 * 예약 요청 생성 DTO (고객이 선택한 슬롯)
 */
public record BookingRequestCreateRequest(
        @NotNull(message = "시작 시각은 필수입니다.")
        Instant startTime,

        @NotNull(message = "종료 시각은 필수입니다.")
        Instant endTime,

        @NotBlank(message = "고객 이름은 필수입니다.")
        @Size(max = 100, message = "고객 이름은 100자 이하입니다.")
        String customerName,

        @NotBlank(message = "고객 이메일은 필수입니다.")
        @Email(message = "이메일 형식이 올바르지 않습니다.")
        String customerEmail,

        @Size(max = 30, message = "전화번호는 30자 이하입니다.")
        String customerPhone,

        String notes
) {
    public CreateBookingRequestCommand toCommand(Long hostId) {
        return new CreateBookingRequestCommand(
                hostId,
                new TimeInterval(startTime, endTime),
                new CustomerInfo(customerName, customerEmail, customerPhone, notes));
    }
}
