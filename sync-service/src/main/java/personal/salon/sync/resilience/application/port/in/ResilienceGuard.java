package personal.salon.sync.resilience.application.port.in;

import java.util.function.Supplier;

/**
 * Resilience Guard
 * 외부 서비스 호출을 Circuit Breaker와 Bulkhead로 감싸는 진입점
 */
public interface ResilienceGuard {

    /**
     * 기본 환경(sync.resilience.environment)으로 호출
     */
    <T> T execute(String service, Supplier<T> call);

    /**
     * 1. 호출 허용 확인 (OPEN이면 CircuitOpenException, 호출하지 않음)
     * 2. Bulkhead 안에서 호출
     * 3. 결과를 Circuit 상태에 반영 (클라이언트 오류 4xx는 실패로 세지 않음)
     */
    <T> T execute(String service, String environment, Supplier<T> call);

    default void run(String service, Runnable call) {
        execute(service, () -> {
            call.run();
            return null;
        });
    }
}
