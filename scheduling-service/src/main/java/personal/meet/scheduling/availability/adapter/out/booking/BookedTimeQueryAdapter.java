package personal.meet.scheduling.availability.adapter.out.booking;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.availability.application.port.out.BookedTimeQueryPort;
import personal.meet.scheduling.booking.application.port.out.BookingRepository;
import personal.meet.scheduling.booking.domain.model.Booking;
import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.util.List;

/**
 * Booked Time Query Adapter
 * 슬롯 계산을 위해 Booking 저장소에서 확정 예약 구간을 조회
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookedTimeQueryAdapter implements BookedTimeQueryPort {

    private final BookingRepository bookingRepository;

    @Override
    public List<TimeInterval> findConfirmedIntervals(Long hostId, TimeInterval range) {
        List<TimeInterval> intervals = bookingRepository
                .findConfirmedByHostBetween(hostId, range.start(), range.end()).stream()
                .map(Booking::interval)
                .toList();
        log.debug("Confirmed intervals loaded: hostId={}, from={}, to={}, count={}",
                hostId, range.start(), range.end(), intervals.size());
        return intervals;
    }
}
