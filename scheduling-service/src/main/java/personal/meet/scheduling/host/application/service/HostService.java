package personal.meet.scheduling.host.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.meet.scheduling.host.application.port.in.GetHostUseCase;
import personal.meet.scheduling.host.application.port.out.HostRepository;
import personal.meet.scheduling.host.domain.exception.HostNotFoundException;
import personal.meet.scheduling.host.domain.model.Host;

/**
 * Host Application Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class HostService implements GetHostUseCase {

    private final HostRepository hostRepository;

    @Override
    public Host getHost(Long hostId) {
        return hostRepository.findById(hostId)
                .orElseThrow(() -> {
                    log.warn("Host not found: hostId={}", hostId);
                    return new HostNotFoundException(hostId);
                });
    }

    @Override
    public boolean exists(Long hostId) {
        var exists = hostRepository.existsById(hostId);
        log.debug("Host existence check: hostId={}, exists={}", hostId, exists);
        return exists;
    }
}
