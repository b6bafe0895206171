package personal.salon.sync.device.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.salon.sync.device.adapter.in.web.dto.DeviceResponse;
import personal.salon.sync.device.adapter.in.web.dto.RegisterDeviceRequest;
import personal.salon.sync.device.application.port.in.GetDevicesUseCase;
import personal.salon.sync.device.application.port.in.ManageDeviceUseCase;
import personal.salon.sync.device.application.port.in.RegisterDeviceUseCase;
import personal.salon.sync.device.domain.model.Device;

import java.util.List;
import java.util.UUID;

/**
 * Device API Controller
 * 디바이스 등록/해제 및 Primary 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/devices")
@RequiredArgsConstructor
public class DeviceController {

    private final RegisterDeviceUseCase registerDeviceUseCase;
    private final ManageDeviceUseCase manageDeviceUseCase;
    private final GetDevicesUseCase getDevicesUseCase;

    /**
     * 디바이스 등록 또는 갱신 (하트비트 겸용)
     * POST /api/v1/devices
     */
    @PostMapping
    public ResponseEntity<DeviceResponse> registerDevice(
            @Valid @RequestBody RegisterDeviceRequest request,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        log.info("Register device: userId={}, deviceId={}, platform={}", userId, request.deviceId(), request.platform());

        Device device = registerDeviceUseCase.registerOrRefresh(request.toCommand(userId));

        return ResponseEntity.ok(DeviceResponse.from(device));
    }

    /**
     * 활성 디바이스 목록
     * GET /api/v1/devices
     */
    @GetMapping
    public ResponseEntity<List<DeviceResponse>> getActiveDevices(@RequestHeader("X-User-Id") UUID userId) {
        List<DeviceResponse> response = getDevicesUseCase.getActiveDevices(userId).stream()
                .map(DeviceResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    /**
     * 디바이스 등록 해제 (soft delete)
     * DELETE /api/v1/devices/{deviceId}
     */
    @DeleteMapping("/{deviceId}")
    public ResponseEntity<DeviceResponse> unregisterDevice(
            @PathVariable String deviceId,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        log.info("Unregister device: userId={}, deviceId={}", userId, deviceId);
        return ResponseEntity.ok(DeviceResponse.from(manageDeviceUseCase.unregister(userId, deviceId)));
    }

    /**
     * Primary 디바이스 전환
     * PUT /api/v1/devices/{deviceId}/primary
     */
    @PutMapping("/{deviceId}/primary")
    public ResponseEntity<DeviceResponse> promoteToPrimary(
            @PathVariable String deviceId,
            @RequestHeader("X-User-Id") UUID userId
    ) {
        log.info("Promote device to primary: userId={}, deviceId={}", userId, deviceId);
        return ResponseEntity.ok(DeviceResponse.from(manageDeviceUseCase.promoteToPrimary(userId, deviceId)));
    }
}
