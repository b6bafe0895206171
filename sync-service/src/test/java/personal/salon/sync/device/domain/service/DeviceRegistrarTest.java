package personal.salon.sync.device.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.salon.sync.device.application.port.in.RegisterDeviceCommand;
import personal.salon.sync.device.application.port.out.DeviceRepository;
import personal.salon.sync.device.domain.exception.DeviceNotFoundException;
import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.device.domain.model.DeviceMetadata;
import personal.salon.sync.device.domain.model.Platform;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeviceRegistrar 단위 테스트")
class DeviceRegistrarTest {

    private static final UUID USER_ID = UUID.fromString("7f1c0c7e-7b9c-4d56-9c35-1f0e4a9b8d21");
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private DeviceRepository deviceRepository;

    private DeviceRegistrar deviceRegistrar;

    @BeforeEach
    void setUp() {
        deviceRegistrar = new DeviceRegistrar(deviceRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(deviceRepository.save(any(Device.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private Device device(String deviceId, boolean active, boolean primary) {
        return new Device(1L, USER_ID, deviceId, Platform.IOS, "iPhone", "1.0.0", "17.4", "token-" + deviceId,
                active, primary, NOW.minusSeconds(3600), null, NOW.minusSeconds(86400));
    }

    @Test
    @DisplayName("플랫폼의 첫 활성 디바이스는 Primary로 등록된다")
    void firstDeviceBecomesPrimary() {
        // given
        given(deviceRepository.findByUserIdAndDeviceId(USER_ID, "ios-1")).willReturn(Optional.empty());
        given(deviceRepository.existsActivePrimary(USER_ID, Platform.IOS)).willReturn(false);

        // when
        Device result = deviceRegistrar.registerInTransaction(
                new RegisterDeviceCommand(USER_ID, "ios-1", Platform.IOS, DeviceMetadata.empty()), true);

        // then
        assertThat(result.primary()).isTrue();
        assertThat(result.active()).isTrue();
        assertThat(result.lastSeenAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("이미 Primary가 있으면 새 디바이스는 Primary가 아니다")
    void secondDeviceIsNotPrimary() {
        // given
        given(deviceRepository.findByUserIdAndDeviceId(USER_ID, "ios-2")).willReturn(Optional.empty());
        given(deviceRepository.existsActivePrimary(USER_ID, Platform.IOS)).willReturn(true);

        // when
        Device result = deviceRegistrar.registerInTransaction(
                new RegisterDeviceCommand(USER_ID, "ios-2", Platform.IOS, null), true);

        // then
        assertThat(result.primary()).isFalse();
    }

    @Test
    @DisplayName("재등록은 메타데이터와 last_seen_at만 갱신하고 Primary 여부는 유지한다")
    void refreshKeepsPrimaryFlag() {
        // given
        given(deviceRepository.findByUserIdAndDeviceId(USER_ID, "ios-1"))
                .willReturn(Optional.of(device("ios-1", true, false)));
        DeviceMetadata metadata = new DeviceMetadata(null, "1.1.0", null, null, null);

        // when
        Device result = deviceRegistrar.registerInTransaction(
                new RegisterDeviceCommand(USER_ID, "ios-1", Platform.IOS, metadata), true);

        // then
        assertThat(result.primary()).isFalse();
        assertThat(result.appVersion()).isEqualTo("1.1.0");
        assertThat(result.deviceName()).isEqualTo("iPhone");
        assertThat(result.lastSeenAt()).isEqualTo(NOW);
        verify(deviceRepository, never()).existsActivePrimary(any(), any());
    }

    @Test
    @DisplayName("Primary 디바이스를 해제하면 가장 최근 접속한 디바이스가 Primary를 승계한다")
    void unregisterHandsOverPrimary() {
        // given
        given(deviceRepository.findByUserIdAndDeviceId(USER_ID, "ios-1"))
                .willReturn(Optional.of(device("ios-1", true, true)));
        Device successor = device("ios-2", true, false);
        given(deviceRepository.findMostRecentlySeenActive(USER_ID, Platform.IOS, "ios-1"))
                .willReturn(Optional.of(successor));

        // when
        Device result = deviceRegistrar.unregisterInTransaction(USER_ID, "ios-1");

        // then
        assertThat(result.active()).isFalse();
        assertThat(result.primary()).isFalse();
        verify(deviceRepository).save(successor.promote());
    }

    @Test
    @DisplayName("Primary 전환은 기존 Primary를 먼저 해제한다")
    void promoteDemotesCurrentPrimaryFirst() {
        // given
        Device target = device("ios-2", true, false);
        Device current = device("ios-1", true, true);
        given(deviceRepository.findByUserIdAndDeviceId(USER_ID, "ios-2")).willReturn(Optional.of(target));
        given(deviceRepository.findActivePrimary(USER_ID, Platform.IOS)).willReturn(Optional.of(current));

        // when
        Device result = deviceRegistrar.promoteInTransaction(USER_ID, "ios-2");

        // then
        assertThat(result.primary()).isTrue();
        InOrder order = inOrder(deviceRepository);
        order.verify(deviceRepository).save(current.demote());
        order.verify(deviceRepository).save(target.promote());
    }

    @Test
    @DisplayName("없는 디바이스 해제는 DeviceNotFoundException")
    void unregisterUnknownDevice() {
        // given
        given(deviceRepository.findByUserIdAndDeviceId(USER_ID, "ghost")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> deviceRegistrar.unregisterInTransaction(USER_ID, "ghost"))
                .isInstanceOf(DeviceNotFoundException.class)
                .hasMessageContaining("ghost");
    }
}
