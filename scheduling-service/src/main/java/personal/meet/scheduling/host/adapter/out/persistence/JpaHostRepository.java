package personal.meet.scheduling.host.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Host
 */
public interface JpaHostRepository extends JpaRepository<HostEntity, Long> {
}
