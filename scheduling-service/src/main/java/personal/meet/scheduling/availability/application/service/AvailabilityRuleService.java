package personal.meet.scheduling.availability.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.meet.scheduling.availability.application.port.in.CreateAvailabilityRuleCommand;
import personal.meet.scheduling.availability.application.port.in.GetAvailabilityRulesUseCase;
import personal.meet.scheduling.availability.application.port.in.ManageAvailabilityRuleUseCase;
import personal.meet.scheduling.availability.application.port.in.UpdateAvailabilityRuleCommand;
import personal.meet.scheduling.availability.application.port.out.AccountDirectory;
import personal.meet.scheduling.availability.application.port.out.AvailabilityRuleRepository;
import personal.meet.scheduling.availability.domain.exception.AvailabilityRuleNotFoundException;
import personal.meet.scheduling.availability.domain.model.AvailabilityRule;

import java.util.Comparator;
import java.util.List;

/**
 * Availability Rule Service
 * 규칙 조회와 호스트의 규칙 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityRuleService implements GetAvailabilityRulesUseCase, ManageAvailabilityRuleUseCase {

    private static final Comparator<AvailabilityRule> BY_DAY_AND_START =
            Comparator.comparingInt(AvailabilityRule::dayOfWeek)
                    .thenComparing(AvailabilityRule::startTime);

    private final AvailabilityRuleRepository availabilityRuleRepository;
    private final AccountDirectory accountDirectory;

    @Override
    public List<AvailabilityRule> rulesFor(Long hostId, int dayOfWeek) {
        accountDirectory.ensureHostExists(hostId);
        return availabilityRuleRepository.findByHostIdAndDayOfWeek(hostId, dayOfWeek).stream()
                .sorted(Comparator.comparing(AvailabilityRule::startTime))
                .toList();
    }

    @Override
    public List<AvailabilityRule> listRules(Long hostId) {
        accountDirectory.ensureHostExists(hostId);
        return availabilityRuleRepository.findByHostId(hostId).stream()
                .sorted(BY_DAY_AND_START)
                .toList();
    }

    @Override
    public AvailabilityRule getRule(Long hostId, Long ruleId) {
        return loadOwnedRule(hostId, ruleId);
    }

    @Override
    @Transactional
    public AvailabilityRule createRule(CreateAvailabilityRuleCommand command) {
        accountDirectory.ensureHostExists(command.hostId());

        AvailabilityRule rule = AvailabilityRule.create(
                command.hostId(),
                command.dayOfWeek(),
                command.startTime(),
                command.endTime(),
                command.bufferMinutes(),
                command.maxBookingsPerDay());
        AvailabilityRule saved = availabilityRuleRepository.save(rule);

        log.info("Availability rule created: hostId={}, ruleId={}, dayOfWeek={}, window={}-{}",
                saved.hostId(), saved.id(), saved.dayOfWeek(), saved.startTime(), saved.endTime());
        return saved;
    }

    @Override
    @Transactional
    public AvailabilityRule updateRule(UpdateAvailabilityRuleCommand command) {
        AvailabilityRule current = loadOwnedRule(command.hostId(), command.ruleId());

        AvailabilityRule merged = current.update(
                command.dayOfWeek(),
                command.startTime(),
                command.endTime(),
                command.bufferMinutes(),
                command.maxBookingsPerDay(),
                command.clearMaxBookingsPerDay());
        AvailabilityRule saved = availabilityRuleRepository.save(merged);

        log.info("Availability rule updated: hostId={}, ruleId={}", saved.hostId(), saved.id());
        return saved;
    }

    @Override
    @Transactional
    public void deleteRule(Long hostId, Long ruleId) {
        loadOwnedRule(hostId, ruleId);
        availabilityRuleRepository.deleteById(ruleId);
        log.info("Availability rule deleted: hostId={}, ruleId={}", hostId, ruleId);
    }

    private AvailabilityRule loadOwnedRule(Long hostId, Long ruleId) {
        return availabilityRuleRepository.findById(ruleId)
                .filter(rule -> rule.hostId().equals(hostId))
                .orElseThrow(() -> {
                    log.warn("Availability rule not found: hostId={}, ruleId={}", hostId, ruleId);
                    return new AvailabilityRuleNotFoundException(hostId, ruleId);
                });
    }
}
