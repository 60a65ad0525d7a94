package personal.meet.scheduling.availability.application.port.in;

import personal.meet.scheduling.availability.domain.model.AvailabilityRule;

import java.util.List;

/**
 * Get Availability Rules UseCase (Input Port)
 * 가용 시간 규칙 조회 유스케이스
 */
public interface GetAvailabilityRulesUseCase {

    /**
     * 특정 요일의 규칙 조회 (시작 시각 순)
     *
     * @param hostId    호스트 ID
     * @param dayOfWeek 0=일요일 .. 6=토요일
     * @return 규칙 목록 (없으면 빈 목록)
     * @throws personal.meet.scheduling.host.domain.exception.HostNotFoundException 호스트가 존재하지 않을 때
     */
    List<AvailabilityRule> rulesFor(Long hostId, int dayOfWeek);

    /**
     * 호스트의 전체 규칙 조회 (요일, 시작 시각 순)
     */
    List<AvailabilityRule> listRules(Long hostId);

    /**
     * 단일 규칙 조회
     * @throws personal.meet.scheduling.availability.domain.exception.AvailabilityRuleNotFoundException
     *         규칙이 없거나 다른 호스트 소유일 때
     */
    AvailabilityRule getRule(Long hostId, Long ruleId);
}
