/*
 * どこで: common のイベント payload 定義
 * 何を: 汎用通知の payload
 * なぜ: 種別を持たない運用メッセージも同じ封筒で届けるため
 */
package com.handreceipt.common.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeneralNotificationPayload(String title, String message, Map<String, Object> data) {
  public GeneralNotificationPayload {
    // 呼び出し側の Map を共有しない
    if (data != null) {
      data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
  }
}
