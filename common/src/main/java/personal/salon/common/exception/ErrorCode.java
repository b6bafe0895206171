package personal.salon.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (1xxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "인증이 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C003", "권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Device Domain (2xxx)
    DEVICE_NOT_FOUND(HttpStatus.NOT_FOUND, "D001", "디바이스를 찾을 수 없습니다."),
    UNKNOWN_PLATFORM(HttpStatus.BAD_REQUEST, "D002", "지원하지 않는 플랫폼입니다."),
    DEVICE_INACTIVE(HttpStatus.CONFLICT, "D003", "비활성화된 디바이스입니다."),

    // Sync Domain (3xxx)
    SYNC_ENTRY_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "동기화 기록을 찾을 수 없습니다."),
    UNKNOWN_ENTITY_TYPE(HttpStatus.BAD_REQUEST, "S002", "동기화 대상이 아닌 엔티티 타입입니다."),
    INVALID_SYNC_PAYLOAD(HttpStatus.BAD_REQUEST, "S003", "동기화 페이로드가 올바르지 않습니다."),

    // Offline Queue Domain (4xxx)
    OPERATION_NOT_FOUND(HttpStatus.NOT_FOUND, "O001", "오프라인 작업을 찾을 수 없습니다."),
    UNKNOWN_OPERATION_TYPE(HttpStatus.BAD_REQUEST, "O002", "지원하지 않는 작업 유형입니다."),
    INVALID_OPERATION_STATE(HttpStatus.CONFLICT, "O003", "현재 상태에서 처리할 수 없는 작업입니다."),

    // Notification Domain (5xxx)
    NOTIFICATION_NOT_FOUND(HttpStatus.NOT_FOUND, "N001", "알림을 찾을 수 없습니다."),
    PUSH_DELIVERY_FAILED(HttpStatus.BAD_GATEWAY, "N002", "푸시 전송에 실패했습니다."),
    PUSH_TOKEN_MISSING(HttpStatus.UNPROCESSABLE_ENTITY, "N003", "푸시 토큰이 등록되지 않은 디바이스입니다."),
    INVALID_NOTIFICATION_STATE(HttpStatus.CONFLICT, "N004", "현재 상태에서 처리할 수 없는 알림입니다."),
    NOT_NOTIFICATION_TARGET(HttpStatus.BAD_REQUEST, "N005", "알림 전송 대상이 아닌 디바이스입니다."),

    // External Service (6xxx)
    EXTERNAL_SERVICE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E001", "외부 서비스 오류가 발생했습니다."),
    EXTERNAL_SERVICE_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "E002", "외부 서비스 응답 시간 초과입니다."),
    CIRCUIT_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "E003", "외부 서비스 호출이 일시적으로 차단되었습니다."),
    CREDENTIAL_NOT_FOUND(HttpStatus.NOT_FOUND, "E004", "활성화된 인증 정보가 없습니다."),
    CREDENTIAL_EXPIRED(HttpStatus.UNAUTHORIZED, "E005", "인증 정보가 만료되었습니다."),
    CREDENTIAL_CRYPTO_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "E006", "인증 정보 암복호화에 실패했습니다."),
    EXTERNAL_REQUEST_REJECTED(HttpStatus.UNPROCESSABLE_ENTITY, "E007", "외부 서비스가 요청을 거부했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
