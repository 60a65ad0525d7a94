package personal.meet.scheduling.availability.application.port.in;

import personal.meet.scheduling.availability.domain.model.AvailabilityRule;

/**
 * Manage Availability Rule UseCase (Input Port)
 * 호스트의 가용 시간 규칙 생성/수정/삭제
 */
public interface ManageAvailabilityRuleUseCase {

    AvailabilityRule createRule(CreateAvailabilityRuleCommand command);

    /**
     * 부분 수정. 전달된 필드만 변경된다.
     */
    AvailabilityRule updateRule(UpdateAvailabilityRuleCommand command);

    void deleteRule(Long hostId, Long ruleId);
}
