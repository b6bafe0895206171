package personal.salon.sync.resilience.application.port.out;

/**
 * 외부 서비스 헬스 프로브 Port
 */
public interface HealthProbePort {

    ProbeResult probe(String url);

    /**
     * @param statusCode HTTP 상태 코드 (연결 실패 시 null)
     */
    record ProbeResult(Integer statusCode, long responseTimeMs, String error) {

        public boolean isSuccessful() {
            return statusCode != null && statusCode >= 200 && statusCode < 300;
        }
    }
}
