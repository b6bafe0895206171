package personal.salon.common.exception;

/**
 * 비즈니스 예외의 최상위 클래스
 * ErrorCode로 HTTP Status와 응답 코드를 결정
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 클라이언트 오류(4xx) 여부
     * Circuit Breaker 실패 집계에서 제외하는 기준으로 사용
     */
    public boolean isClientError() {
        return errorCode.getHttpStatus().is4xxClientError();
    }
}
