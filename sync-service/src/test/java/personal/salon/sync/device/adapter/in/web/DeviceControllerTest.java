package personal.salon.sync.device.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.salon.sync.device.application.port.in.GetDevicesUseCase;
import personal.salon.sync.device.application.port.in.ManageDeviceUseCase;
import personal.salon.sync.device.application.port.in.RegisterDeviceCommand;
import personal.salon.sync.device.application.port.in.RegisterDeviceUseCase;
import personal.salon.sync.device.domain.exception.DeviceNotFoundException;
import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.device.domain.model.DeviceMetadata;
import personal.salon.sync.device.domain.model.Platform;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DeviceController.class)
@DisplayName("Device API 단위 테스트")
class DeviceControllerTest {

    private static final UUID USER_ID = UUID.fromString("7f1c0c7e-7b9c-4d56-9c35-1f0e4a9b8d21");
    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RegisterDeviceUseCase registerDeviceUseCase;

    @MockBean
    private ManageDeviceUseCase manageDeviceUseCase;

    @MockBean
    private GetDevicesUseCase getDevicesUseCase;

    @Test
    @DisplayName("디바이스를 등록하면 푸시 토큰 없이 디바이스 정보를 반환한다")
    void registerDevice() throws Exception {
        // given
        Device device = Device.register(USER_ID, "ios-1", Platform.IOS,
                new DeviceMetadata("iPhone", "2.4.0", "17.2", "apns-token", null), true, NOW);
        given(registerDeviceUseCase.registerOrRefresh(any(RegisterDeviceCommand.class))).willReturn(device);

        // when & then
        mockMvc.perform(post("/api/v1/devices")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"deviceId": "ios-1", "platform": "ios", "deviceName": "iPhone", "pushToken": "apns-token"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deviceId").value("ios-1"))
                .andExpect(jsonPath("$.platform").value("IOS"))
                .andExpect(jsonPath("$.primary").value(true))
                .andExpect(jsonPath("$.pushToken").doesNotExist());
    }

    @Test
    @DisplayName("지원하지 않는 플랫폼은 400(D002)을 반환하고 등록하지 않는다")
    void unknownPlatform() throws Exception {
        // when & then
        mockMvc.perform(post("/api/v1/devices")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"deviceId": "tv-1", "platform": "tizen"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("D002"));

        then(registerDeviceUseCase).should(never()).registerOrRefresh(any());
    }

    @Test
    @DisplayName("디바이스 ID가 비어 있으면 400(C001)을 반환한다")
    void blankDeviceId() throws Exception {
        // when & then
        mockMvc.perform(post("/api/v1/devices")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"deviceId": " ", "platform": "web"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("활성 디바이스 목록을 반환한다")
    void getActiveDevices() throws Exception {
        // given
        given(getDevicesUseCase.getActiveDevices(USER_ID)).willReturn(List.of(
                Device.register(USER_ID, "web-1", Platform.WEB, DeviceMetadata.empty(), true, NOW),
                Device.register(USER_ID, "ios-1", Platform.IOS, DeviceMetadata.empty(), true, NOW)));

        // when & then
        mockMvc.perform(get("/api/v1/devices").header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].deviceId").value("web-1"));
    }

    @Test
    @DisplayName("다른 사용자의 디바이스는 해제할 수 없다 (404)")
    void unregisterUnknownDevice() throws Exception {
        // given
        given(manageDeviceUseCase.unregister(USER_ID, "ios-9"))
                .willThrow(new DeviceNotFoundException(USER_ID, "ios-9"));

        // when & then
        mockMvc.perform(delete("/api/v1/devices/ios-9").header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("D001"));
    }
}
