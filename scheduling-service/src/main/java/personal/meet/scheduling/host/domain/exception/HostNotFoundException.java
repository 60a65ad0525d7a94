package personal.meet.scheduling.host.domain.exception;

import personal.meet.common.exception.BusinessException;
import personal.meet.common.exception.ErrorCode;

/**
 * Host Not Found Exception
 */
public class HostNotFoundException extends BusinessException {
    public HostNotFoundException(Long hostId) {
        super(ErrorCode.HOST_NOT_FOUND, String.format("Host not found: hostId=%d", hostId));
    }
}
