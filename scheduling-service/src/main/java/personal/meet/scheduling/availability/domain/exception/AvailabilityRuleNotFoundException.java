package personal.meet.scheduling.availability.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

/**
 * Availability Rule Not Found Exception
 */
public class AvailabilityRuleNotFoundException extends BusinessException {
    public AvailabilityRuleNotFoundException(Long hostId, Long ruleId) {
        super(ErrorCode.AVAILABILITY_RULE_NOT_FOUND,
                String.format("Availability rule not found: hostId=%d, ruleId=%d", hostId, ruleId));
    }
}
