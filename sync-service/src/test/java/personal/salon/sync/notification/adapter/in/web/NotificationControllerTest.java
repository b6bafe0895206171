package personal.salon.sync.notification.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.salon.sync.notification.application.port.in.ManageNotificationUseCase;
import personal.salon.sync.notification.application.port.in.QueueNotificationCommand;
import personal.salon.sync.notification.application.port.in.QueueNotificationUseCase;
import personal.salon.sync.notification.domain.exception.InvalidNotificationStateException;
import personal.salon.sync.notification.domain.exception.NotificationNotFoundException;
import personal.salon.sync.notification.domain.model.DeliveryOutcome;
import personal.salon.sync.notification.domain.model.Notification;
import personal.salon.sync.notification.domain.model.NotificationPriority;
import personal.salon.sync.notification.domain.model.NotificationStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(NotificationController.class)
@DisplayName("Notification API 단위 테스트")
class NotificationControllerTest {

    private static final UUID USER_ID = UUID.fromString("7f1c0c7e-7b9c-4d56-9c35-1f0e4a9b8d21");
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueueNotificationUseCase queueNotificationUseCase;

    @MockBean
    private ManageNotificationUseCase manageNotificationUseCase;

    private static Notification notification() {
        return Notification.pending(USER_ID, "예약 확정", "예약이 확정되었습니다.", "BOOKING_CONFIRMED",
                NotificationPriority.HIGH, Map.of("booking_id", "b-1"), List.of(), List.of("web-1"),
                null, null, Duration.ofHours(24), NOW);
    }

    @Test
    @DisplayName("알림 등록은 201 Created와 PENDING 상태를 반환한다")
    void queueNotificationReturnsCreated() throws Exception {
        // given
        given(queueNotificationUseCase.enqueue(any(QueueNotificationCommand.class))).willReturn(notification());

        // when & then
        mockMvc.perform(post("/api/v1/notifications")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "title": "예약 확정",
                                  "message": "예약이 확정되었습니다.",
                                  "type": "BOOKING_CONFIRMED",
                                  "priority": "high",
                                  "data": {"booking_id": "b-1"},
                                  "excludeDevices": ["web-1"]
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.priority").value("HIGH"))
                .andExpect(jsonPath("$.excludeDevices[0]").value("web-1"));
    }

    @Test
    @DisplayName("제목이 비어 있으면 400을 반환한다")
    void blankTitleRejected() throws Exception {
        // when & then
        mockMvc.perform(post("/api/v1/notifications")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "", "message": "본문", "type": "BOOKING_CONFIRMED"}
                                """))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(queueNotificationUseCase);
    }

    @Test
    @DisplayName("다른 사용자의 알림 조회는 404를 반환한다")
    void notificationNotFound() throws Exception {
        // given
        given(manageNotificationUseCase.getNotification(USER_ID, 99L)).willThrow(new NotificationNotFoundException(99L));

        // when & then
        mockMvc.perform(get("/api/v1/notifications/99").header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("N001"));
    }

    @Test
    @DisplayName("디바이스 수신 확인은 소문자 전달 상태로 응답한다")
    void recordDeliveryOutcome() throws Exception {
        // given
        given(manageNotificationUseCase.recordDeliveryOutcome(USER_ID, 10L, "ios-1", DeliveryOutcome.SENT))
                .willReturn(notification().withDeliveryOutcome("ios-1", DeliveryOutcome.SENT));

        // when & then
        mockMvc.perform(put("/api/v1/notifications/10/deliveries/ios-1")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"outcome": "sent"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deliveryStatus['ios-1']").value("sent"));
    }

    @Test
    @DisplayName("만료된 알림에 수신 확인을 보내면 409 Conflict를 반환한다")
    void recordDeliveryOutcomeOnExpiredNotification() throws Exception {
        // given
        given(manageNotificationUseCase.recordDeliveryOutcome(USER_ID, 10L, "ios-1", DeliveryOutcome.SENT))
                .willThrow(new InvalidNotificationStateException(10L, NotificationStatus.EXPIRED,
                        "record delivery outcome for"));

        // when & then
        mockMvc.perform(put("/api/v1/notifications/10/deliveries/ios-1")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"outcome": "sent"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("N004"));
    }
}
