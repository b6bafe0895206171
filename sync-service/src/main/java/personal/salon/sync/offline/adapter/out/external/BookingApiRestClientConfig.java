package personal.salon.sync.offline.adapter.out.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Booking API RestClient 설정
 *
 * Timeout:
 * - Connect Timeout: TCP 연결 실패 빠른 감지
 * - Read Timeout: drain 한 회차가 하위 서비스 지연에 묶이지 않도록 제한
 */
@Configuration
public class BookingApiRestClientConfig {

    @Value("${external.booking-service.base-url}")
    private String bookingServiceBaseUrl;

    @Value("${external.booking-service.connect-timeout-ms:500}")
    private int connectTimeoutMs;

    @Value("${external.booking-service.read-timeout-ms:3000}")
    private int readTimeoutMs;

    @Bean
    public RestClient bookingServiceRestClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return RestClient.builder()
                .baseUrl(bookingServiceBaseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
