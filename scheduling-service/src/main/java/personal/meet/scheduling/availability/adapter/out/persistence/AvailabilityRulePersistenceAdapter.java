package personal.meet.scheduling.availability.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.availability.application.port.out.AvailabilityRuleRepository;
import personal.meet.scheduling.availability.domain.model.AvailabilityRule;

import java.util.List;
import java.util.Optional;

/**
 * Availability Rule Persistence Adapter
 * JPA를 사용한 가용 시간 규칙 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityRulePersistenceAdapter implements AvailabilityRuleRepository {

    private final JpaAvailabilityRuleRepository jpaAvailabilityRuleRepository;

    @Override
    public List<AvailabilityRule> findByHostIdAndDayOfWeek(Long hostId, int dayOfWeek) {
        log.debug("Finding availability rules: hostId={}, dayOfWeek={}", hostId, dayOfWeek);
        return jpaAvailabilityRuleRepository.findByHostIdAndDayOfWeekOrderByStartTimeAsc(hostId, dayOfWeek).stream()
                .map(AvailabilityRuleEntity::toDomain)
                .toList();
    }

    @Override
    public List<AvailabilityRule> findByHostId(Long hostId) {
        log.debug("Finding all availability rules: hostId={}", hostId);
        return jpaAvailabilityRuleRepository.findByHostIdOrderByDayOfWeekAscStartTimeAsc(hostId).stream()
                .map(AvailabilityRuleEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<AvailabilityRule> findById(Long ruleId) {
        return jpaAvailabilityRuleRepository.findById(ruleId)
                .map(AvailabilityRuleEntity::toDomain);
    }

    @Override
    public AvailabilityRule save(AvailabilityRule rule) {
        log.debug("Saving availability rule: hostId={}, ruleId={}", rule.hostId(), rule.id());
        return jpaAvailabilityRuleRepository.save(AvailabilityRuleEntity.fromDomain(rule)).toDomain();
    }

    @Override
    public void deleteById(Long ruleId) {
        jpaAvailabilityRuleRepository.deleteById(ruleId);
    }
}
