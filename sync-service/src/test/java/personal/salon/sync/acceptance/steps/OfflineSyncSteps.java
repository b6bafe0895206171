package personal.salon.sync.acceptance.steps;

import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.ScenarioScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.salon.sync.acceptance.support.FakeDownstreamAdapter;
import personal.salon.sync.acceptance.support.MutableClock;
import personal.salon.sync.acceptance.support.SyncAcceptanceConfiguration;
import personal.salon.sync.acceptance.support.SyncTestContext;
import personal.salon.sync.ledger.application.port.in.QuerySyncLedgerUseCase;
import personal.salon.sync.ledger.domain.model.EntityType;
import personal.salon.sync.ledger.domain.model.SyncLogEntry;
import personal.salon.sync.offline.application.port.in.DrainOfflineQueueUseCase;
import personal.salon.sync.offline.application.port.in.EnqueueOfflineOperationUseCase;
import personal.salon.sync.offline.application.port.in.EnqueueOperationCommand;
import personal.salon.sync.offline.application.port.in.ManageOfflineOperationUseCase;
import personal.salon.sync.offline.domain.model.OperationStatus;
import personal.salon.sync.offline.domain.model.OperationType;
import personal.salon.sync.offline.domain.model.QueuedOperation;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 오프라인 작업 제출/처리 Step Definitions
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class OfflineSyncSteps {

    private final SyncTestContext context;
    private final EnqueueOfflineOperationUseCase enqueueOfflineOperationUseCase;
    private final ManageOfflineOperationUseCase manageOfflineOperationUseCase;
    private final DrainOfflineQueueUseCase drainOfflineQueueUseCase;
    private final QuerySyncLedgerUseCase querySyncLedgerUseCase;
    private final FakeDownstreamAdapter downstream;
    private final MutableClock clock;

    // ==========================================
    // Given: 사전 상태
    // ==========================================

    @Given("디바이스 {string}가 오프라인 상태에서 예약 {string}을 {string}에 생성했다")
    public void 오프라인_상태에서_예약을_생성했다(String deviceId, String bookingId, String time) {
        log.info(">>> Given: 오프라인 변경 - deviceId={}, bookingId={}, updatedAt={}", deviceId, bookingId, time);
        context.getOfflineEdits().put(deviceId, bookingPayload(bookingId, deviceId, time));
    }

    @Given("하위 서비스가 응답하지 않는다")
    public void 하위_서비스가_응답하지_않는다() {
        log.info(">>> Given: 하위 서비스 장애");
        downstream.becomeUnavailable();
    }

    @Given("디바이스 {string}가 최대 재시도 {int}회로 예약 {string} 생성 작업을 제출했다")
    public void 최대_재시도_횟수를_지정해_작업을_제출했다(String deviceId, int maxRetries, String bookingId) {
        log.info(">>> Given: 작업 제출 - deviceId={}, maxRetries={}", deviceId, maxRetries);
        submit(deviceId, bookingPayload(bookingId, deviceId, "08:30"), maxRetries);
    }

    // ==========================================
    // When: 행위
    // ==========================================

    @When("디바이스 {string}가 예약 {string}을 {string}에 생성하여 동기화했다")
    public void 예약을_생성하여_동기화했다(String deviceId, String bookingId, String time) {
        log.info(">>> When: 온라인 동기화 - deviceId={}, bookingId={}", deviceId, bookingId);
        submit(deviceId, bookingPayload(bookingId, deviceId, time), null);
        context.setLastDrainResult(drainOfflineQueueUseCase.drain());
    }

    @When("디바이스 {string}가 다시 연결되어 대기 중인 작업을 제출한다")
    public void 다시_연결되어_대기_중인_작업을_제출한다(String deviceId) {
        log.info(">>> When: 재연결 후 제출 - deviceId={}", deviceId);
        clock.advance(Duration.ofMinutes(10));
        submit(deviceId, context.getOfflineEdits().get(deviceId), null);
        context.setLastDrainResult(drainOfflineQueueUseCase.drain());
    }

    @When("큐를 처리한다")
    public void 큐를_처리한다() {
        log.info(">>> When: 큐 처리 - now={}", clock.instant());
        context.setLastDrainResult(drainOfflineQueueUseCase.drain());
    }

    @When("{int}분이 지나고 큐를 처리한다")
    public void 시간이_지나고_큐를_처리한다(int minutes) {
        clock.advance(Duration.ofMinutes(minutes));
        큐를_처리한다();
    }

    // ==========================================
    // Then: 결과 검증
    // ==========================================

    @Then("디바이스 {string}의 작업은 {string}으로 완료된다")
    public void 작업은_결정으로_완료된다(String deviceId, String action) {
        QueuedOperation operation = reload(deviceId);
        assertThat(operation.status()).isEqualTo(OperationStatus.COMPLETED);

        SyncLogEntry entry = latestLedgerEntryOf(operation);
        assertThat(entry.resolutionAction()).isNotNull();
        assertThat(entry.resolutionAction().wireValue()).isEqualTo(action);
    }

    @And("원장에 디바이스 {string}의 충돌이 기록된다")
    public void 원장에_충돌이_기록된다(String deviceId) {
        SyncLogEntry entry = latestLedgerEntryOf(reload(deviceId));
        assertThat(entry.conflictDetected()).isTrue();
    }

    @And("하위 서비스에는 디바이스 {string}의 호출이 전달되지 않는다")
    public void 하위_서비스에_호출이_전달되지_않는다(String deviceId) {
        assertThat(downstream.callsFrom(deviceId)).isEmpty();
    }

    @And("예약 {string}의 서버 상태는 디바이스 {string}가 만든 값이다")
    public void 서버_상태는_디바이스가_만든_값이다(String bookingId, String deviceId) {
        SyncLogEntry latest = querySyncLedgerUseCase.latestState(EntityType.BOOKING, bookingId).orElseThrow();
        assertThat(latest.dataAfter()).containsEntry("created_by", deviceId);
    }

    @Then("작업 상태는 {string}이고 재시도 횟수는 {int}이다")
    public void 작업_상태와_재시도_횟수를_확인한다(String status, int retryCount) {
        QueuedOperation operation = reload(onlySubmittedDevice());
        assertThat(operation.status()).isEqualTo(OperationStatus.valueOf(status));
        assertThat(operation.retryCount()).isEqualTo(retryCount);
    }

    @And("다음 재시도는 {int}분 후이다")
    public void 다음_재시도는_N분_후이다(int minutes) {
        QueuedOperation operation = reload(onlySubmittedDevice());
        assertThat(operation.nextRetryAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(minutes)));
    }

    @Then("처리된 작업이 없다")
    public void 처리된_작업이_없다() {
        assertThat(context.getLastDrainResult().processed()).isZero();
    }

    @And("작업의 다음 재시도 시각이 없다")
    public void 작업의_다음_재시도_시각이_없다() {
        assertThat(reload(onlySubmittedDevice()).nextRetryAt()).isNull();
    }

    @And("작업이 dead letter 목록에 있다")
    public void 작업이_dead_letter_목록에_있다() {
        Long operationId = context.submittedBy(onlySubmittedDevice()).id();
        assertThat(manageOfflineOperationUseCase.deadLetters())
                .extracting(QueuedOperation::id)
                .containsExactly(operationId);
    }

    @And("하위 서비스는 {int}번 호출되었다")
    public void 하위_서비스_호출_횟수를_확인한다(int count) {
        assertThat(downstream.calls()).hasSize(count);
    }

    private void submit(String deviceId, Map<String, Object> payload, Integer maxRetries) {
        QueuedOperation operation = enqueueOfflineOperationUseCase.enqueue(new EnqueueOperationCommand(
                context.getUserId(),
                deviceId,
                OperationType.CREATE_BOOKING,
                deviceId + "-" + payload.get("entity_id"),
                payload,
                null,
                maxRetries));
        context.submitted(operation);
    }

    private QueuedOperation reload(String deviceId) {
        Long operationId = context.submittedBy(deviceId).id();
        return manageOfflineOperationUseCase.getOperation(context.getUserId(), operationId);
    }

    private String onlySubmittedDevice() {
        assertThat(context.getSubmittedOperations()).hasSize(1);
        return context.getSubmittedOperations().keySet().iterator().next();
    }

    private SyncLogEntry latestLedgerEntryOf(QueuedOperation operation) {
        String entityId = operation.payload().get("entity_id").toString();
        return querySyncLedgerUseCase.latestByDevice(
                        operation.userId(), EntityType.BOOKING, entityId, operation.deviceId())
                .orElseThrow(() -> new AssertionError("No ledger entry for device: " + operation.deviceId()));
    }

    private static Map<String, Object> bookingPayload(String bookingId, String deviceId, String time) {
        LocalDate day = LocalDate.ofInstant(SyncAcceptanceConfiguration.START, ZoneOffset.UTC);
        Map<String, Object> payload = new HashMap<>();
        payload.put("entity_id", bookingId);
        payload.put("service_id", "cut-basic");
        payload.put("created_by", deviceId);
        payload.put("updated_at", day.atTime(LocalTime.parse(time)).toInstant(ZoneOffset.UTC).toString());
        return payload;
    }
}
