package personal.salon.sync.offline.application.port.out;

import personal.salon.sync.offline.domain.model.OperationContext;

import java.util.Map;

/**
 * 프로필/설정 쓰기 경로 Port (외부 협력 서비스)
 */
public interface ProfileCommandPort {

    void updateProfile(OperationContext context, String profileId, Map<String, Object> payload);

    void updatePreferences(OperationContext context, String profileId, Map<String, Object> payload);
}
