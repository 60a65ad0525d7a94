package personal.meet.scheduling.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.BookingStatus;
import personal.meet.scheduling.booking.domain.model.CustomerInfo;

import java.time.Instant;

/**
 * Booking JPA Entity
 * 확정/취소 예약 테이블 매핑. 하나의 예약 요청은 최대 하나의 예약만 만든다.
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_booking_request",
                columnNames = {"booking_request_id"}
        ),
        indexes = @Index(name = "idx_booking_host_start", columnList = "host_id, start_time"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "host_id", nullable = false)
    private Long hostId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "customer_name", nullable = false, length = 100)
    private String customerName;

    @Column(name = "customer_email", nullable = false, length = 255)
    private String customerEmail;

    @Column(name = "customer_phone", length = 30)
    private String customerPhone;

    @Column(name = "customer_notes", columnDefinition = "TEXT")
    private String customerNotes;

    @Column(name = "booking_request_id")
    private Long bookingRequestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.hostId = booking.hostId();
        entity.startTime = booking.startTime();
        entity.endTime = booking.endTime();
        entity.status = booking.status();
        entity.customerName = booking.customer().name();
        entity.customerEmail = booking.customer().email();
        entity.customerPhone = booking.customer().phone();
        entity.customerNotes = booking.customer().notes();
        entity.bookingRequestId = booking.bookingRequestId();
        entity.createdAt = booking.createdAt();
        return entity;
    }

    public Booking toDomain() {
        return new Booking(id, hostId, startTime, endTime, status,
                new CustomerInfo(customerName, customerEmail, customerPhone, customerNotes),
                bookingRequestId, createdAt);
    }
}
