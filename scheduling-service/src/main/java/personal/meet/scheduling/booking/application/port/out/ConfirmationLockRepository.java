package personal.meet.scheduling.booking.application.port.out;

import java.time.Duration;

/**
 * Confirmation Lock Repository (Output Port)
 * Redis SETNX 기반 확정 중복 실행 방지
 */
public interface ConfirmationLockRepository {

    /**
     * 확정 선점 시도
     * Fail-Fast: 선점 실패 시 대기하지 않고 즉시 false 반환
     *
     * @param confirmationToken 확정 토큰
     * @param owner             선점 소유자 식별값
     * @param ttl               락 유지 시간
     * @return true: 선점 성공, false: 이미 다른 호출이 확정 중
     */
    boolean tryLock(String confirmationToken, String owner, Duration ttl);

    /**
     * 선점 해제 (소유자 확인 후 삭제)
     */
    void unlock(String confirmationToken, String owner);
}
