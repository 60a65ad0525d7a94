package personal.meet.scheduling.booking.domain.model;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

/**
 * 예약 고객 연락처
 *
 * @param name  고객 이름
 * @param email 고객 이메일
 * @param phone 전화번호 (선택)
 * @param notes 메모 (선택)
 */
public record CustomerInfo(
        String name,
        String email,
        String phone,
        String notes) {

    public CustomerInfo {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer name cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer email cannot be null or blank");
        }
    }

    public static CustomerInfo of(String name, String email) {
        return new CustomerInfo(name, email, null, null);
    }
}
