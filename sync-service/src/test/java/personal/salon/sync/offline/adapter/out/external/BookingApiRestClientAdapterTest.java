package personal.salon.sync.offline.adapter.out.external;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.offline.domain.model.OperationContext;
import personal.salon.sync.resilience.application.port.in.GetActiveCredentialUseCase;
import personal.salon.sync.resilience.domain.exception.CredentialExpiredException;
import personal.salon.sync.resilience.domain.model.Credential;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

/**
 * Booking API 어댑터 단위 테스트 (WireMock)
 * 4xx는 EXTERNAL_REQUEST_REJECTED, 5xx/timeout은 EXTERNAL_SERVICE_ERROR로 변환되는지 검증
 */
@WireMockTest
@ExtendWith(MockitoExtension.class)
@DisplayName("BookingApiRestClientAdapter 단위 테스트 (WireMock)")
class BookingApiRestClientAdapterTest {

    private static final UUID USER_ID = UUID.fromString("7f1c0c7e-7b9c-4d56-9c35-1f0e4a9b8d21");
    private static final OperationContext CONTEXT = new OperationContext(USER_ID, "ios-1", "key-1");
    private static final Map<String, Object> PAYLOAD = Map.of(
            "entity_id", "b-1", "updated_at", "2025-03-01T09:58:00Z", "service_id", "svc-7");

    @Mock
    private GetActiveCredentialUseCase getActiveCredentialUseCase;

    private RestClient restClient;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmRuntimeInfo) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(200))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(500));

        restClient = RestClient.builder()
                .baseUrl(wmRuntimeInfo.getHttpBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    private BookingApiRestClientAdapter adapter(String credentialService) {
        return new BookingApiRestClientAdapter(restClient, getActiveCredentialUseCase, credentialService, "production");
    }

    @Test
    @DisplayName("예약 생성 시 멱등 키와 사용자/디바이스 헤더를 함께 전달한다")
    void createBookingSendsHeaders() {
        // given
        stubFor(post(urlEqualTo("/api/v1/bookings")).willReturn(aResponse().withStatus(201)));

        // when
        adapter("").createBooking(CONTEXT, "b-1", PAYLOAD);

        // then
        verify(postRequestedFor(urlEqualTo("/api/v1/bookings"))
                .withHeader(BookingApiRestClientAdapter.IDEMPOTENCY_KEY_HEADER, equalTo("key-1"))
                .withHeader(BookingApiRestClientAdapter.USER_ID_HEADER, equalTo(USER_ID.toString()))
                .withHeader(BookingApiRestClientAdapter.DEVICE_ID_HEADER, equalTo("ios-1"))
                .withoutHeader(BookingApiRestClientAdapter.API_KEY_HEADER)
                .withRequestBody(matchingJsonPath("$.service_id", equalTo("svc-7"))));
    }

    @Test
    @DisplayName("자격 증명 서비스가 설정되면 X-Api-Key 헤더를 첨부한다")
    void attachesApiKey() {
        // given
        stubFor(put(urlEqualTo("/api/v1/profiles/u-1")).willReturn(aResponse().withStatus(200)));
        given(getActiveCredentialUseCase.getActive("booking-service", "production"))
                .willReturn(new Credential(1L, "booking-service", "production", "api-key", "api-secret", null));

        // when
        adapter("booking-service").updateProfile(CONTEXT, "u-1", PAYLOAD);

        // then
        verify(putRequestedFor(urlEqualTo("/api/v1/profiles/u-1"))
                .withHeader(BookingApiRestClientAdapter.API_KEY_HEADER, equalTo("api-key")));
    }

    @Test
    @DisplayName("만료된 자격 증명이면 네트워크 호출 없이 실패한다")
    void expiredCredentialFailsBeforeCall() {
        // given
        given(getActiveCredentialUseCase.getActive("booking-service", "production"))
                .willThrow(new CredentialExpiredException("booking-service", "production", Instant.parse("2025-01-01T00:00:00Z")));

        // when & then
        assertThatThrownBy(() -> adapter("booking-service").cancelBooking(CONTEXT, "b-1", PAYLOAD))
                .isInstanceOf(CredentialExpiredException.class);
        verify(0, anyRequestedFor(anyUrl()));
    }

    @Test
    @DisplayName("4xx 응답은 EXTERNAL_REQUEST_REJECTED로 변환된다")
    void clientErrorIsRejected() {
        // given
        stubFor(post(urlEqualTo("/api/v1/bookings/b-1/cancel")).willReturn(aResponse().withStatus(409)));

        // when & then
        assertThatThrownBy(() -> adapter("").cancelBooking(CONTEXT, "b-1", PAYLOAD))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.EXTERNAL_REQUEST_REJECTED);
    }

    @Test
    @DisplayName("5xx 응답은 EXTERNAL_SERVICE_ERROR로 변환된다")
    void serverErrorIsUnavailable() {
        // given
        stubFor(put(urlEqualTo("/api/v1/profiles/u-1/preferences")).willReturn(aResponse().withStatus(503)));

        // when & then
        assertThatThrownBy(() -> adapter("").updatePreferences(CONTEXT, "u-1", PAYLOAD))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.EXTERNAL_SERVICE_ERROR);
    }

    @Test
    @DisplayName("응답 지연으로 Read Timeout이 나면 EXTERNAL_SERVICE_ERROR로 변환된다")
    void readTimeoutIsUnavailable() {
        // given
        stubFor(post(urlEqualTo("/api/v1/bookings")).willReturn(aResponse().withStatus(201).withFixedDelay(1500)));

        // when & then
        assertThatThrownBy(() -> adapter("").createBooking(CONTEXT, "b-1", PAYLOAD))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.EXTERNAL_SERVICE_ERROR);
    }
}
