package personal.meet.scheduling.availability.application.port.out;

import personal.meet.scheduling.availability.domain.model.AvailabilityRule;

import java.util.List;
import java.util.Optional;

/**
 * Availability Rule Repository (Output Port)
 */
public interface AvailabilityRuleRepository {

    List<AvailabilityRule> findByHostIdAndDayOfWeek(Long hostId, int dayOfWeek);

    List<AvailabilityRule> findByHostId(Long hostId);

    Optional<AvailabilityRule> findById(Long ruleId);

    AvailabilityRule save(AvailabilityRule rule);

    void deleteById(Long ruleId);
}
