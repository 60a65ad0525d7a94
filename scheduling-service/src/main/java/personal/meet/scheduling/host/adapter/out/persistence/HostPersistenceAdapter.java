package personal.meet.scheduling.host.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.host.application.port.out.HostRepository;
import personal.meet.scheduling.host.domain.model.Host;

import java.util.Optional;

/**
 * Host Persistence Adapter
 * JPA를 사용한 호스트 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HostPersistenceAdapter implements HostRepository {

    private final JpaHostRepository jpaHostRepository;

    @Override
    public Optional<Host> findById(Long hostId) {
        log.debug("Finding host by id: {}", hostId);
        return jpaHostRepository.findById(hostId)
                .map(HostEntity::toDomain);
    }

    @Override
    public boolean existsById(Long hostId) {
        log.debug("Checking if host exists: {}", hostId);
        return jpaHostRepository.existsById(hostId);
    }
}
