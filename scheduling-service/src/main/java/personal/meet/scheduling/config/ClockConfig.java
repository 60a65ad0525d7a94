package personal.meet.scheduling.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시간 소스 설정
 * 모든 "현재 시각" 판단(만료, 과거 날짜, 호라이즌)은 이 Clock을 거친다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
