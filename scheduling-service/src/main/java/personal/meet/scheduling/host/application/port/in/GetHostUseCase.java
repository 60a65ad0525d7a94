package personal.meet.scheduling.host.application.port.in;

import personal.meet.scheduling.host.domain.model.Host;

/**
 * Get Host UseCase (Input Port)
 * 호스트 조회 유스케이스
 */
public interface GetHostUseCase {

    /**
     * 호스트 ID로 조회
     * @param hostId 호스트 ID
     * @return 호스트 정보
     * @throws personal.meet.scheduling.host.domain.exception.HostNotFoundException 호스트가 존재하지 않을 때
     */
    Host getHost(Long hostId);

    /**
     * 호스트 존재 여부 확인
     * @param hostId 호스트 ID
     * @return 존재 여부
     */
    boolean exists(Long hostId);
}
