package personal.meet.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.meet.scheduling.booking.domain.model.BookingRequest;
import personal.meet.scheduling.booking.domain.model.BookingRequestStatus;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;

import java.time.Instant;

/**
 * Booking Request JPA Entity
 * 예약 요청 테이블 매핑
 */
@Entity
@Table(name = "booking_requests",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_confirmation_token",
                columnNames = {"confirmation_token"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingRequestEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "host_id", nullable = false)
    private Long hostId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "customer_name", nullable = false, length = 100)
    private String customerName;

    @Column(name = "customer_email", nullable = false, length = 255)
    private String customerEmail;

    @Column(name = "customer_phone", length = 30)
    private String customerPhone;

    @Column(name = "customer_notes", columnDefinition = "TEXT")
    private String customerNotes;

    @Column(name = "confirmation_token", nullable = false, length = 64)
    private String confirmationToken;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingRequestStatus status;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "booking_id")
    private Long bookingId;

    public static BookingRequestEntity fromDomain(BookingRequest request) {
        BookingRequestEntity entity = new BookingRequestEntity();
        entity.id = request.id();
        entity.hostId = request.hostId();
        entity.startTime = request.startTime();
        entity.endTime = request.endTime();
        entity.customerName = request.customer().name();
        entity.customerEmail = request.customer().email();
        entity.customerPhone = request.customer().phone();
        entity.customerNotes = request.customer().notes();
        entity.confirmationToken = request.confirmationToken();
        entity.status = request.status();
        entity.expiresAt = request.expiresAt();
        entity.createdAt = request.createdAt();
        entity.confirmedAt = request.confirmedAt();
        entity.bookingId = request.bookingId();
        return entity;
    }

    public BookingRequest toDomain() {
        return new BookingRequest(id, hostId, startTime, endTime,
                new CustomerInfo(customerName, customerEmail, customerPhone, customerNotes),
                confirmationToken, status, expiresAt, createdAt, confirmedAt, bookingId);
    }
}
