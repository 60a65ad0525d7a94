package personal.meet.scheduling.availability.adapter.out.host;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.meet.scheduling.availability.application.port.out.AccountDirectory;
import personal.meet.scheduling.host.application.port.in.GetHostUseCase;
import personal.meet.scheduling.host.domain.exception.HostNotFoundException;

import java.time.ZoneId;

/**
 * Account Directory Adapter
 * Host 도메인의 유스케이스로 호스트 설정을 조회
 */
@Component
@RequiredArgsConstructor
public class AccountDirectoryAdapter implements AccountDirectory {

    private final GetHostUseCase getHostUseCase;

    @Override
    public ZoneId getHostTimezone(Long hostId) {
        return getHostUseCase.getHost(hostId).timezone();
    }

    @Override
    public int getBookingHorizonDays(Long hostId) {
        return getHostUseCase.getHost(hostId).bookingHorizonDays();
    }

    @Override
    public void ensureHostExists(Long hostId) {
        if (!getHostUseCase.exists(hostId)) {
            throw new HostNotFoundException(hostId);
        }
    }
}
