package personal.salon.sync.ledger.domain.model;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * 동기화 페이로드의 시각 필드 해석
 * ISO-8601 (offset 포함) 문자열 또는 epoch millis 숫자를 허용
 */
public final class SyncTimestamps {

    public static final String UPDATED_AT = "updated_at";
    public static final String LAST_SYNCED_AT = "last_synced_at";

    private SyncTimestamps() {
    }

    public static Optional<Instant> updatedAtOf(Map<String, Object> data) {
        return read(data, UPDATED_AT);
    }

    public static Optional<Instant> lastSyncedAtOf(Map<String, Object> data) {
        return read(data, LAST_SYNCED_AT);
    }

    /**
     * 필드가 없거나 해석할 수 없으면 empty
     */
    public static Optional<Instant> read(Map<String, Object> data, String field) {
        if (data == null) {
            return Optional.empty();
        }
        Object raw = data.get(field);
        if (raw instanceof Number number) {
            return Optional.of(Instant.ofEpochMilli(number.longValue()));
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(OffsetDateTime.parse(text).toInstant());
            } catch (DateTimeParseException e) {
                try {
                    return Optional.of(Instant.parse(text));
                } catch (DateTimeParseException ignored) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }
}
