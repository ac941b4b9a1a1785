/*
 * どこで: Events Service 層のテスト
 * 何を: 実ハブと組み合わせ、接続中ユーザにはライブ配信、未接続ユーザには永続通知だけが残ることを検証する
 * なぜ: 接続状態に関わらず通知が失われない前提を結合した形で確認するため
 */
package com.handreceipt.events.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.handreceipt.common.event.TransferUpdatePayload;
import com.handreceipt.events.config.HubProperties;
import com.handreceipt.events.config.NotificationProperties;
import com.handreceipt.events.hub.ClientConnection;
import com.handreceipt.events.hub.ClientHub;
import com.handreceipt.events.hub.HubMetrics;
import com.handreceipt.events.hub.RoutingPolicy;
import com.handreceipt.events.model.NotificationRecord;
import com.handreceipt.events.repository.NotificationRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationServiceLiveDeliveryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Mock private NotificationRepository notificationRepository;

  private ClientHub clientHub;
  private NotificationService service;

  @BeforeEach
  void setUp() {
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final ObjectMapper objectMapper = new ObjectMapper();
    clientHub =
        new ClientHub(
            new RoutingPolicy(),
            objectMapper,
            new HubProperties(8, 64, Duration.ofSeconds(2)),
            new HubMetrics(new SimpleMeterRegistry()),
            clock);
    clientHub.start();
    service =
        new NotificationService(
            clientHub,
            notificationRepository,
            new NotificationProperties(50, null),
            objectMapper,
            clock);
  }

  @AfterEach
  void tearDown() {
    clientHub.stop();
  }

  @Test
  void connectedSenderGetsLiveEventAndOfflineRecipientGetsDurableRow() throws Exception {
    final ClientConnection sender = clientHub.connect(1L, null).join();
    when(notificationRepository.insert(any())).thenReturn(100L, 101L);

    service.notifyTransferUpdate(
        new TransferUpdatePayload(7L, 1L, 2L, "approved", "SN-7", "Radio"));

    final String live = sender.poll(Duration.ZERO);
    assertThat(live).contains("\"type\":\"transfer:update\"").contains("\"status\":\"approved\"");
    assertThat(service.isUserOnline(2L)).isFalse();

    final ArgumentCaptor<NotificationRecord> rows =
        ArgumentCaptor.forClass(NotificationRecord.class);
    verify(notificationRepository, times(2)).insert(rows.capture());
    assertThat(rows.getAllValues())
        .filteredOn(row -> row.userId() == 2L)
        .singleElement()
        .satisfies(
            row -> {
              assertThat(row.read()).isFalse();
              assertThat(row.title()).isEqualTo("Transfer approved");
            });
  }
}
