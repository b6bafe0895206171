package personal.salon.sync.resilience.application.service;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.config.SyncProperties;
import personal.salon.sync.resilience.application.port.in.ResilienceGuard;

import java.util.function.Supplier;

/**
 * Resilience Guard Service
 * 영속 Circuit Breaker(서비스/환경 단위) + resilience4j Bulkhead(동시 호출 제한)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResilienceGuardService implements ResilienceGuard {

    private final CircuitBreakerService circuitBreakerService;
    private final BulkheadRegistry bulkheadRegistry;
    private final SyncProperties syncProperties;

    @Override
    public <T> T execute(String service, Supplier<T> call) {
        return execute(service, syncProperties.resilience().environment(), call);
    }

    @Override
    public <T> T execute(String service, String environment, Supplier<T> call) {
        circuitBreakerService.acquirePermission(service, environment);

        Bulkhead bulkhead = bulkheadRegistry.bulkhead(service);
        T result;
        try {
            result = Bulkhead.decorateSupplier(bulkhead, call).get();
        } catch (BulkheadFullException e) {
            // 호출 자체가 일어나지 않았으므로 Circuit에 반영하지 않음
            log.warn("Bulkhead full: service={}, environment={}", service, environment);
            throw new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR,
                    String.format("Too many concurrent calls: service=%s", service), e);
        } catch (BusinessException e) {
            if (!e.isClientError()) {
                circuitBreakerService.recordCallOutcome(service, environment, false);
            }
            throw e;
        } catch (RuntimeException e) {
            log.warn("External call failed: service={}, environment={}, error={}",
                    service, environment, e.getMessage());
            circuitBreakerService.recordCallOutcome(service, environment, false);
            throw e;
        }

        circuitBreakerService.recordCallOutcome(service, environment, true);
        return result;
    }
}
