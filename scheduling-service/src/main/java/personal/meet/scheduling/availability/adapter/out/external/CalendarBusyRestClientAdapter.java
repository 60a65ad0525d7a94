package personal.meet.scheduling.availability.adapter.out.external;

import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import personal.meet.scheduling.availability.application.port.out.ExternalBusyProvider;
import personal.meet.scheduling.availability.domain.exception.CalendarUnavailableException;
import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.time.Instant;
import java.util.List;

/**
 * Calendar Busy REST Client Adapter
 * 캘린더 동기화 서비스에서 busy 구간을 조회하는 구현체 (RestClient 사용)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalendarBusyRestClientAdapter implements ExternalBusyProvider {

    private final RestClient calendarServiceRestClient;

    /**
     * busy 구간 조회
     * Circuit Breaker, Bulkhead, Retry 패턴 적용
     * - 404: 연결된 캘린더 없음 → 빈 목록
     * - 5xx, Timeout: CalendarUnavailableException → Circuit 실패로 카운트
     * - Retry: 연결 실패만 재시도
     */
    @Override
    @CircuitBreaker(name = "calendarService", fallbackMethod = "getBusyIntervalsFallback")
    @Bulkhead(name = "calendarService", fallbackMethod = "getBusyIntervalsFallback", type = Bulkhead.Type.SEMAPHORE)
    @Retry(name = "calendarService")
    public List<TimeInterval> getBusyIntervals(Long hostId, Instant rangeStart, Instant rangeEnd) {
        log.debug("Fetching busy intervals: hostId={}, from={}, to={}", hostId, rangeStart, rangeEnd);

        CalendarBusyResponse response;
        try {
            response = calendarServiceRestClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/api/v1/hosts/{hostId}/busy")
                            .queryParam("from", rangeStart.toString())
                            .queryParam("to", rangeEnd.toString())
                            .build(hostId))
                    .retrieve()
                    .onStatus(HttpStatusCode::is5xxServerError, (request, httpResponse) -> {
                        log.error("Calendar service unavailable: status={}", httpResponse.getStatusCode());
                        throw new CalendarUnavailableException(hostId);
                    })
                    .body(CalendarBusyResponse.class);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No connected calendar: hostId={}", hostId);
            return List.of();
        }

        List<TimeInterval> intervals = response == null ? List.of() : response.toIntervals();
        log.debug("Busy intervals fetched: hostId={}, count={}", hostId, intervals.size());
        return intervals;
    }

    /**
     * Fallback 메서드
     * Circuit Breaker Open, Bulkhead Full 또는 재시도 소진 시 호출.
     * 슬롯 계산은 이 예외를 잡아 partial 결과로 강등한다.
     */
    private List<TimeInterval> getBusyIntervalsFallback(Long hostId, Instant rangeStart, Instant rangeEnd,
                                                        Exception e) {
        log.warn("Calendar service call failed: hostId={}, error={}", hostId, e.getClass().getSimpleName());
        if (e instanceof CalendarUnavailableException unavailable) {
            throw unavailable;
        }
        throw new CalendarUnavailableException(hostId, e);
    }
}
