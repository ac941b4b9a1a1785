package com.handreceipt.events.api;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.handreceipt.events.model.NotificationPriority;
import com.handreceipt.events.model.NotificationRecord;
import com.handreceipt.events.service.NotificationNotFoundException;
import com.handreceipt.events.service.NotificationService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class NotificationControllerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationService notificationService;

  @Test
  void listReturnsNotificationsWithParsedData() throws Exception {
    when(notificationService.getUserNotifications(7L, 10, 0, true))
        .thenReturn(
            List.of(
                new NotificationRecord(
                    42L,
                    7L,
                    "transfer_created",
                    "New Transfer Request",
                    "You have a new transfer request for Radio (SN-1)",
                    "{\"transferId\":9}",
                    NotificationPriority.HIGH,
                    false,
                    null,
                    CREATED_AT,
                    null)));

    mockMvc
        .perform(
            get("/v1/notifications")
                .header("X-User-Id", "7")
                .param("limit", "10")
                .param("unread_only", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value(7))
        .andExpect(jsonPath("$.limit").value(10))
        .andExpect(jsonPath("$.notifications[0].id").value(42))
        .andExpect(jsonPath("$.notifications[0].priority").value("high"))
        .andExpect(jsonPath("$.notifications[0].data.transferId").value(9));
  }

  @Test
  void unreadCountReturnsCount() throws Exception {
    when(notificationService.getUnreadCount(7L)).thenReturn(3L);

    mockMvc
        .perform(get("/v1/notifications/unread-count").header("X-User-Id", "7"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(3));
  }

  @Test
  void markAsReadReturns204() throws Exception {
    mockMvc
        .perform(post("/v1/notifications/42/read").header("X-User-Id", "7"))
        .andExpect(status().isNoContent());

    verify(notificationService).markAsRead(7L, 42L);
  }

  @Test
  void markAsReadOfForeignNotificationReturns404() throws Exception {
    doThrow(new NotificationNotFoundException(42L, 8L))
        .when(notificationService)
        .markAsRead(8L, 42L);

    mockMvc
        .perform(post("/v1/notifications/42/read").header("X-User-Id", "8"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_NOT_FOUND"));
  }

  @Test
  void deleteReturns204() throws Exception {
    mockMvc
        .perform(delete("/v1/notifications/42").header("X-User-Id", "7"))
        .andExpect(status().isNoContent());

    verify(notificationService).deleteNotification(7L, 42L);
  }

  @Test
  void clearOldRejectsNegativeDays() throws Exception {
    when(notificationService.clearOldNotifications(7L, -1))
        .thenThrow(new IllegalArgumentException("days must be non-negative"));

    mockMvc
        .perform(delete("/v1/notifications").header("X-User-Id", "7").param("older_than_days", "-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("EVENTS_BAD_REQUEST"));
  }

  @Test
  void missingUserHeaderReturns400() throws Exception {
    mockMvc
        .perform(get("/v1/notifications/unread-count"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("EVENTS_BAD_REQUEST"));
  }

  @Test
  void nonNumericUserHeaderReturns400() throws Exception {
    mockMvc
        .perform(get("/v1/notifications/unread-count").header("X-User-Id", "abc"))
        .andExpect(status().isBadRequest());
  }
}
