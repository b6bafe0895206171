package personal.salon.sync.device.application.port.in;

import personal.salon.sync.device.domain.model.Device;

/**
 * Register Device UseCase (Input Port)
 */
public interface RegisterDeviceUseCase {

    /**
     * 디바이스 등록 또는 갱신
     * (user, deviceId)가 이미 있으면 메타데이터/last_seen_at 갱신 및 재활성화,
     * 없으면 신규 생성하며 해당 플랫폼의 첫 활성 디바이스는 Primary로 선출
     *
     * @return 등록/갱신된 디바이스
     */
    Device registerOrRefresh(RegisterDeviceCommand command);
}
