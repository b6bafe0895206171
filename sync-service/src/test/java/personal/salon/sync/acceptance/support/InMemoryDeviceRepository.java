package personal.salon.sync.acceptance.support;

import personal.salon.sync.device.application.port.out.DeviceRepository;
import personal.salon.sync.device.domain.model.Device;
import personal.salon.sync.device.domain.model.Platform;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

public class InMemoryDeviceRepository implements DeviceRepository {

    private final Map<Long, Device> devices = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public void clear() {
        devices.clear();
    }

    @Override
    public Device save(Device device) {
        Device saved = device.id() != null ? device : new Device(
                sequence.incrementAndGet(),
                device.userId(),
                device.deviceId(),
                device.platform(),
                device.deviceName(),
                device.appVersion(),
                device.osVersion(),
                device.pushToken(),
                device.active(),
                device.primary(),
                device.lastSeenAt(),
                device.preferences(),
                device.createdAt());
        devices.put(saved.id(), saved);
        return saved;
    }

    @Override
    public Optional<Device> findByUserIdAndDeviceId(UUID userId, String deviceId) {
        return ofUser(userId)
                .filter(device -> device.deviceId().equals(deviceId))
                .findFirst();
    }

    @Override
    public List<Device> findActiveByUserId(UUID userId) {
        return ofUser(userId)
                .filter(Device::active)
                .sorted(Comparator.comparing(Device::lastSeenAt).reversed())
                .toList();
    }

    @Override
    public boolean existsActivePrimary(UUID userId, Platform platform) {
        return findActivePrimary(userId, platform).isPresent();
    }

    @Override
    public Optional<Device> findActivePrimary(UUID userId, Platform platform) {
        return ofUser(userId)
                .filter(device -> device.active() && device.primary() && device.platform() == platform)
                .findFirst();
    }

    @Override
    public Optional<Device> findMostRecentlySeenActive(UUID userId, Platform platform, String excludeDeviceId) {
        return ofUser(userId)
                .filter(device -> device.active() && device.platform() == platform)
                .filter(device -> !Objects.equals(device.deviceId(), excludeDeviceId))
                .max(Comparator.comparing(Device::lastSeenAt));
    }

    private Stream<Device> ofUser(UUID userId) {
        return devices.values().stream()
                .filter(device -> device.userId().equals(userId));
    }
}
