package personal.salon.sync.resilience.adapter.out.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Health Probe RestClient 설정
 * 프로브 대상마다 URL이 다르므로 baseUrl 없이 생성
 */
@Configuration
public class HealthProbeConfig {

    @Value("${sync.health.connect-timeout-ms:500}")
    private int connectTimeoutMs;

    @Value("${sync.health.read-timeout-ms:3000}")
    private int readTimeoutMs;

    @Bean
    public RestClient healthProbeRestClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
