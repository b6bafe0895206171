package personal.salon.sync.offline.adapter.out.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.offline.application.port.out.BookingCommandPort;
import personal.salon.sync.offline.application.port.out.ProfileCommandPort;
import personal.salon.sync.offline.domain.model.OperationContext;
import personal.salon.sync.resilience.application.port.in.GetActiveCredentialUseCase;
import personal.salon.sync.resilience.domain.model.Credential;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Booking API REST Client Adapter
 * 예약/프로필 쓰기 경로 호출 (RestClient)
 *
 * - Idempotency-Key 헤더: 재전달 시 하위 서비스가 중복 적용하지 않도록 작업 키 전달
 * - 4xx: EXTERNAL_REQUEST_REJECTED (클라이언트 오류 → Circuit 실패로 세지 않음)
 * - 5xx, 연결 실패/timeout: EXTERNAL_SERVICE_ERROR (Circuit 실패로 집계)
 * - credential-service 설정 시 활성 자격 증명을 X-Api-Key 헤더로 첨부 (만료 시 호출 전 실패)
 */
@Slf4j
@Component
public class BookingApiRestClientAdapter implements BookingCommandPort, ProfileCommandPort {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String USER_ID_HEADER = "X-User-Id";
    static final String DEVICE_ID_HEADER = "X-Device-Id";
    static final String API_KEY_HEADER = "X-Api-Key";

    private final RestClient restClient;
    private final GetActiveCredentialUseCase getActiveCredentialUseCase;
    private final String credentialService;
    private final String environment;

    public BookingApiRestClientAdapter(
            @Qualifier("bookingServiceRestClient") RestClient restClient,
            GetActiveCredentialUseCase getActiveCredentialUseCase,
            @Value("${external.booking-service.credential-service:}") String credentialService,
            @Value("${sync.resilience.environment:production}") String environment) {
        this.restClient = restClient;
        this.getActiveCredentialUseCase = getActiveCredentialUseCase;
        this.credentialService = credentialService;
        this.environment = environment;
    }

    @Override
    public void createBooking(OperationContext context, String bookingId, Map<String, Object> payload) {
        log.debug("Creating booking: bookingId={}, idempotencyKey={}", bookingId, context.idempotencyKey());
        send(restClient.post().uri("/api/v1/bookings"), context, payload);
    }

    @Override
    public void cancelBooking(OperationContext context, String bookingId, Map<String, Object> payload) {
        log.debug("Cancelling booking: bookingId={}, idempotencyKey={}", bookingId, context.idempotencyKey());
        send(restClient.post().uri("/api/v1/bookings/{bookingId}/cancel", bookingId), context, payload);
    }

    @Override
    public void updateProfile(OperationContext context, String profileId, Map<String, Object> payload) {
        log.debug("Updating profile: profileId={}, idempotencyKey={}", profileId, context.idempotencyKey());
        send(restClient.put().uri("/api/v1/profiles/{profileId}", profileId), context, payload);
    }

    @Override
    public void updatePreferences(OperationContext context, String profileId, Map<String, Object> payload) {
        log.debug("Updating preferences: profileId={}, idempotencyKey={}", profileId, context.idempotencyKey());
        send(restClient.put().uri("/api/v1/profiles/{profileId}/preferences", profileId), context, payload);
    }

    private void send(RestClient.RequestBodySpec request, OperationContext context, Map<String, Object> payload) {
        Consumer<HttpHeaders> credentialHeaders = credentialHeaders();
        try {
            request.contentType(MediaType.APPLICATION_JSON)
                    .header(IDEMPOTENCY_KEY_HEADER, context.idempotencyKey())
                    .header(USER_ID_HEADER, context.userId().toString())
                    .header(DEVICE_ID_HEADER, context.deviceId())
                    .headers(credentialHeaders)
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, response) -> {
                        log.warn("Booking API rejected request: status={}, idempotencyKey={}",
                                response.getStatusCode(), context.idempotencyKey());
                        throw new BusinessException(ErrorCode.EXTERNAL_REQUEST_REJECTED,
                                String.format("Booking API rejected request: status=%s", response.getStatusCode()));
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, response) -> {
                        log.error("Booking API unavailable: status={}", response.getStatusCode());
                        throw new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR,
                                String.format("Booking API unavailable: status=%s", response.getStatusCode()));
                    })
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR,
                    String.format("Booking API call failed: %s", e.getMessage()), e);
        }
    }

    private Consumer<HttpHeaders> credentialHeaders() {
        if (credentialService == null || credentialService.isBlank()) {
            return headers -> { };
        }
        // CredentialNotFound / CredentialExpired는 네트워크 호출 전에 전파
        Credential credential = getActiveCredentialUseCase.getActive(credentialService, environment);
        return headers -> headers.set(API_KEY_HEADER, credential.apiKey());
    }
}
