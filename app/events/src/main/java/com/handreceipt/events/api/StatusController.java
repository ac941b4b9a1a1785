/*
 * どこで: Events API
 * 何を: ルートの簡易ヘルスレスポンスと接続中ユーザ数を返す
 * なぜ: 起動確認とライブ配信ハブの状態確認を手早く行うため
 */
package com.handreceipt.events.api;

import com.handreceipt.events.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final NotificationService notificationService;

  @GetMapping("/")
  public String home() {
    return "events: ok online=" + notificationService.getOnlineUsers().size();
  }
}
