package personal.meet.scheduling.availability.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Spring Data JPA Repository for AvailabilityRule
 */
public interface JpaAvailabilityRuleRepository extends JpaRepository<AvailabilityRuleEntity, Long> {

    List<AvailabilityRuleEntity> findByHostIdAndDayOfWeekOrderByStartTimeAsc(Long hostId, int dayOfWeek);

    List<AvailabilityRuleEntity> findByHostIdOrderByDayOfWeekAscStartTimeAsc(Long hostId);
}
