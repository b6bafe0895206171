package personal.salon.sync.resilience.adapter.out.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import personal.salon.sync.resilience.application.port.out.HealthProbePort;

import java.time.Clock;

/**
 * HTTP GET 헬스 프로브
 * 4xx/5xx도 예외 없이 상태 코드로 반환, 판정은 호출자가 수행
 */
@Slf4j
@Component
public class HttpHealthProbeAdapter implements HealthProbePort {

    private final RestClient restClient;
    private final Clock clock;

    public HttpHealthProbeAdapter(@Qualifier("healthProbeRestClient") RestClient restClient, Clock clock) {
        this.restClient = restClient;
        this.clock = clock;
    }

    @Override
    public ProbeResult probe(String url) {
        long startedAt = clock.millis();
        try {
            Integer statusCode = restClient.get()
                    .uri(url)
                    .exchange((request, response) -> response.getStatusCode().value());
            return new ProbeResult(statusCode, clock.millis() - startedAt, null);
        } catch (RestClientException e) {
            log.debug("Health probe failed: url={}, error={}", url, e.getMessage());
            return new ProbeResult(null, clock.millis() - startedAt, e.getMessage());
        }
    }
}
