package personal.meet.scheduling.host.application.port.out;

import personal.meet.scheduling.host.domain.model.Host;

import java.util.Optional;

/**
 * Host Repository (Output Port)
 * 호스트 저장소 인터페이스
 */
public interface HostRepository {

    /**
     * 호스트 ID로 조회
     * @param hostId 호스트 ID
     * @return 호스트 정보 (없으면 Optional.empty())
     */
    Optional<Host> findById(Long hostId);

    /**
     * 호스트 존재 여부 확인
     * @param hostId 호스트 ID
     * @return 존재 여부
     */
    boolean existsById(Long hostId);
}
