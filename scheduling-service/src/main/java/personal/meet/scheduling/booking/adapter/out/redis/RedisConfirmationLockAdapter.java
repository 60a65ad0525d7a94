package personal.meet.scheduling.booking.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.booking.application.port.out.ConfirmationLockRepository;

import java.time.Duration;
import java.util.Collections;

/**
 * Redis Confirmation Lock Adapter
 * Redis SETNX 기반 확정 선점 구현체
 * Lua Script를 사용한 원자적 락 해제 (소유권 검증)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisConfirmationLockAdapter implements ConfirmationLockRepository {

    private static final String CONFIRM_LOCK_PREFIX = "booking-request:confirm:";
    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> releaseLockScript;

    @Override
    public boolean tryLock(String confirmationToken, String owner, Duration ttl) {
        String key = CONFIRM_LOCK_PREFIX + confirmationToken;

        // SETNX + TTL을 원자적으로 수행 (setIfAbsent)
        Boolean success = redisTemplate.opsForValue().setIfAbsent(key, owner, ttl);
        boolean locked = Boolean.TRUE.equals(success);

        log.debug("Confirmation lock attempt: owner={}, success={}", owner, locked);
        return locked;
    }

    @Override
    public void unlock(String confirmationToken, String owner) {
        String key = CONFIRM_LOCK_PREFIX + confirmationToken;

        try {
            // GET + DELETE를 원자적으로 수행하여 소유권 검증
            Long result = redisTemplate.execute(releaseLockScript, Collections.singletonList(key), owner);

            if (result != null && result == 1L) {
                log.debug("Confirmation lock released: owner={}", owner);
            } else {
                log.warn("Failed to release confirmation lock (not owned or already expired): owner={}", owner);
            }
        } catch (Exception e) {
            // TTL이 지나면 자동 해제되므로 확정 결과에 영향 없음
            log.error("Error releasing confirmation lock: owner={}", owner, e);
        }
    }
}
