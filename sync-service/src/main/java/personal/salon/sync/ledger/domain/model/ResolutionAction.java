package personal.salon.sync.ledger.domain.model;

import java.util.Locale;

/**
 * 충돌 해결 결정
 */
public enum ResolutionAction {
    /**
     * 수신 값이 더 최신 → 수신 값 채택
     */
    USE_LATEST,

    /**
     * 서버 값이 같거나 더 최신 → 서버 값 유지
     */
    KEEP_EXISTING;

    /**
     * API 응답 표기 ("use_latest" / "keep_existing")
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
