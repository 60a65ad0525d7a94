package personal.meet.scheduling.availability.application.port.out;

import java.time.ZoneId;

/**
 * Account Directory (Output Port)
 * 슬롯 계산에 필요한 호스트 설정 조회
 */
public interface AccountDirectory {

    /**
     * @throws personal.meet.scheduling.host.domain.exception.HostNotFoundException 호스트가 존재하지 않을 때
     */
    ZoneId getHostTimezone(Long hostId);

    /**
     * @throws personal.meet.scheduling.host.domain.exception.HostNotFoundException 호스트가 존재하지 않을 때
     */
    int getBookingHorizonDays(Long hostId);

    /**
     * @throws personal.meet.scheduling.host.domain.exception.HostNotFoundException 호스트가 존재하지 않을 때
     */
    void ensureHostExists(Long hostId);
}
