package personal.salon.sync.offline.domain.model;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncOperation;
import personal.salon.sync.ledger.domain.model.SyncTimestamps;
import personal.salon.sync.offline.application.port.out.BookingCommandPort;
import personal.salon.sync.offline.application.port.out.ProfileCommandPort;

import java.util.Map;

/**
 * 오프라인 작업 (유형별 variant)
 * 페이로드에는 entity_id와 updated_at이 필수
 */
public sealed interface OfflineOperation
        permits OfflineOperation.CreateBooking, OfflineOperation.UpdateProfile,
        OfflineOperation.CancelBooking, OfflineOperation.UpdatePreferences {

    String ENTITY_ID = "entity_id";

    String entityId();

    Map<String, Object> payload();

    EntityType entityType();

    /**
     * 원장에 기록되는 변경 유형
     */
    SyncOperation syncOperation();

    void apply(OperationContext context, BookingCommandPort bookingCommandPort, ProfileCommandPort profileCommandPort);

    /**
     * 유형과 페이로드로 variant 생성
     *
     * @throws BusinessException INVALID_SYNC_PAYLOAD: entity_id 또는 updated_at 누락
     */
    static OfflineOperation of(OperationType type, Map<String, Object> payload) {
        if (payload == null) {
            throw new BusinessException(ErrorCode.INVALID_SYNC_PAYLOAD, "Payload cannot be null");
        }
        Object rawEntityId = payload.get(ENTITY_ID);
        if (rawEntityId == null || rawEntityId.toString().isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_SYNC_PAYLOAD, "Payload requires entity_id");
        }
        if (SyncTimestamps.updatedAtOf(payload).isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_SYNC_PAYLOAD, "Payload requires a valid updated_at");
        }
        String entityId = rawEntityId.toString();

        return switch (type) {
            case CREATE_BOOKING -> new CreateBooking(entityId, payload);
            case UPDATE_PROFILE -> new UpdateProfile(entityId, payload);
            case CANCEL_BOOKING -> new CancelBooking(entityId, payload);
            case UPDATE_PREFERENCES -> new UpdatePreferences(entityId, payload);
        };
    }

    record CreateBooking(String entityId, Map<String, Object> payload) implements OfflineOperation {

        @Override
        public EntityType entityType() {
            return EntityType.BOOKING;
        }

        @Override
        public SyncOperation syncOperation() {
            return SyncOperation.CREATE;
        }

        @Override
        public void apply(OperationContext context, BookingCommandPort bookingCommandPort,
                          ProfileCommandPort profileCommandPort) {
            bookingCommandPort.createBooking(context, entityId, payload);
        }
    }

    record UpdateProfile(String entityId, Map<String, Object> payload) implements OfflineOperation {

        @Override
        public EntityType entityType() {
            return EntityType.PROFILE;
        }

        @Override
        public SyncOperation syncOperation() {
            return SyncOperation.UPDATE;
        }

        @Override
        public void apply(OperationContext context, BookingCommandPort bookingCommandPort,
                          ProfileCommandPort profileCommandPort) {
            profileCommandPort.updateProfile(context, entityId, payload);
        }
    }

    /**
     * 예약 취소는 예약 상태 변경으로 기록 (삭제 아님)
     */
    record CancelBooking(String entityId, Map<String, Object> payload) implements OfflineOperation {

        @Override
        public EntityType entityType() {
            return EntityType.BOOKING;
        }

        @Override
        public SyncOperation syncOperation() {
            return SyncOperation.UPDATE;
        }

        @Override
        public void apply(OperationContext context, BookingCommandPort bookingCommandPort,
                          ProfileCommandPort profileCommandPort) {
            bookingCommandPort.cancelBooking(context, entityId, payload);
        }
    }

    record UpdatePreferences(String entityId, Map<String, Object> payload) implements OfflineOperation {

        @Override
        public EntityType entityType() {
            return EntityType.PREFERENCES;
        }

        @Override
        public SyncOperation syncOperation() {
            return SyncOperation.UPDATE;
        }

        @Override
        public void apply(OperationContext context, BookingCommandPort bookingCommandPort,
                          ProfileCommandPort profileCommandPort) {
            profileCommandPort.updatePreferences(context, entityId, payload);
        }
    }
}
