package personal.meet.scheduling.booking.adapter.out.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis Configuration
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisScript<Long> releaseLockScript() {
        return RedisScript.of(new ClassPathResource("scripts/release_lock.lua"), Long.class);
    }
}
