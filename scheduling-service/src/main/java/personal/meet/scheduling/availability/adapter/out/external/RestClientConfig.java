package personal.meet.scheduling.availability.adapter.out.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * RestClient Configuration
 * 캘린더 동기화 서비스 클라이언트 설정
 *
 * Timeout 전략:
 * - Connect Timeout: TCP 연결 실패 빠른 감지
 * - Read Timeout: Circuit Breaker Slow Call 기준과 일치
 */
@Configuration
public class RestClientConfig {

    @Value("${external.calendar-service.base-url}")
    private String calendarServiceBaseUrl;

    @Value("${external.calendar-service.connect-timeout-ms:300}")
    private int connectTimeoutMs;

    @Value("${external.calendar-service.read-timeout-ms:1500}")
    private int readTimeoutMs;

    @Bean
    public RestClient calendarServiceRestClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return RestClient.builder()
                .baseUrl(calendarServiceBaseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
