package personal.salon.sync.device.application.port.in;

import personal.salon.sync.device.domain.model.Device;

import java.util.UUID;

/**
 * Manage Device UseCase (Input Port)
 * 등록 해제 및 Primary 전환
 */
public interface ManageDeviceUseCase {

    /**
     * 디바이스 비활성화 (soft delete)
     * Primary였다면 같은 플랫폼의 가장 최근 활성 디바이스로 승계
     *
     * @throws personal.salon.sync.device.domain.exception.DeviceNotFoundException 디바이스가 없을 때
     */
    Device unregister(UUID userId, String deviceId);

    /**
     * 지정한 디바이스를 플랫폼의 Primary로 전환 (기존 Primary는 해제)
     */
    Device promoteToPrimary(UUID userId, String deviceId);
}
