package personal.meet.scheduling.availability.adapter.out.external;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import personal.meet.scheduling.availability.domain.exception.CalendarUnavailableException;
import personal.meet.scheduling.booking.domain.model.TimeInterval;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CalendarBusyRestClientAdapter 테스트
 * WireMock으로 캘린더 동기화 서비스 응답을 흉내내고 public API로 검증
 */
@WireMockTest
@DisplayName("CalendarBusyRestClientAdapter 테스트 (WireMock)")
class CalendarBusyRestClientAdapterTest {

    private static final Long HOST_ID = 1L;
    private static final Instant FROM = Instant.parse("2026-03-01T15:00:00Z");
    private static final Instant TO = Instant.parse("2026-03-02T15:00:00Z");
    private static final String BUSY_PATH = "/api/v1/hosts/1/busy";

    private CalendarBusyRestClientAdapter adapter;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmRuntimeInfo) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(200))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(1000));

        RestClient restClient = RestClient.builder()
                .baseUrl(wmRuntimeInfo.getHttpBaseUrl())
                .requestFactory(requestFactory)
                .build();

        adapter = new CalendarBusyRestClientAdapter(restClient);
    }

    @Test
    @DisplayName("busy 구간을 조회 범위 파라미터와 함께 요청하고 TimeInterval로 변환")
    void fetchBusyIntervals() {
        // given
        stubFor(get(urlPathEqualTo(BUSY_PATH))
                .withQueryParam("from", equalTo(FROM.toString()))
                .withQueryParam("to", equalTo(TO.toString()))
                .willReturn(okJson("""
                        {"busy": [
                          {"start": "2026-03-02T04:00:00Z", "end": "2026-03-02T05:00:00Z"},
                          {"start": "2026-03-02T06:30:00Z", "end": "2026-03-02T07:00:00Z"}
                        ]}
                        """)));

        // when
        List<TimeInterval> intervals = adapter.getBusyIntervals(HOST_ID, FROM, TO);

        // then
        assertThat(intervals).containsExactly(
                new TimeInterval(Instant.parse("2026-03-02T04:00:00Z"), Instant.parse("2026-03-02T05:00:00Z")),
                new TimeInterval(Instant.parse("2026-03-02T06:30:00Z"), Instant.parse("2026-03-02T07:00:00Z")));
    }

    @Test
    @DisplayName("busy 필드가 없으면 빈 목록")
    void emptyBody() {
        // given
        stubFor(get(urlPathEqualTo(BUSY_PATH)).willReturn(okJson("{}")));

        // when & then
        assertThat(adapter.getBusyIntervals(HOST_ID, FROM, TO)).isEmpty();
    }

    @Test
    @DisplayName("404는 연결된 캘린더가 없는 것으로 보고 빈 목록")
    void notFound_NoCalendar() {
        // given
        stubFor(get(urlPathEqualTo(BUSY_PATH)).willReturn(notFound()));

        // when & then
        assertThat(adapter.getBusyIntervals(HOST_ID, FROM, TO)).isEmpty();
    }

    @Test
    @DisplayName("5xx는 CalendarUnavailableException")
    void serverError_Unavailable() {
        // given
        stubFor(get(urlPathEqualTo(BUSY_PATH)).willReturn(serviceUnavailable()));

        // when & then
        assertThatThrownBy(() -> adapter.getBusyIntervals(HOST_ID, FROM, TO))
                .isInstanceOf(CalendarUnavailableException.class)
                .hasMessageContaining("hostId=1");
    }

    @Test
    @DisplayName("연속된 5xx로 Circuit이 OPEN되면 더 이상 호출하지 않는다")
    void circuitOpensAfterFailures() {
        // given
        stubFor(get(urlPathEqualTo(BUSY_PATH)).willReturn(serverError()));
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(4)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(10))
                .recordExceptions(CalendarUnavailableException.class)
                .build();
        CircuitBreaker circuitBreaker = CircuitBreakerRegistry.of(config).circuitBreaker("calendarService");

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> circuitBreaker.executeSupplier(
                    () -> adapter.getBusyIntervals(HOST_ID, FROM, TO)))
                    .isInstanceOf(CalendarUnavailableException.class);
        }

        // when & then
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThatThrownBy(() -> circuitBreaker.executeSupplier(
                () -> adapter.getBusyIntervals(HOST_ID, FROM, TO)))
                .isInstanceOf(CallNotPermittedException.class);
        verify(2, getRequestedFor(urlPathEqualTo(BUSY_PATH)));
    }
}
