package personal.salon.common.exception;

import java.time.Instant;

/**
 * 에러 응답 포맷
 *
 * @param result    항상 "error"
 * @param code      ErrorCode의 코드 (예: "D001")
 * @param message   사용자 메시지
 * @param timestamp 발생 시각
 */
public record ErrorResponse(
        String result,
        String code,
        String message,
        Instant timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse("error", errorCode.getCode(), message, Instant.now());
    }
}
