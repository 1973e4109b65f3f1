/*
 * どこで: Entitlement API
 * 何を: ハンドラ実行中の失敗を表す
 * なぜ: 5xx を返してプロバイダの再送に処理を委ねるため
 */
package com.dentfinder.entitlement.api;

public class WebhookProcessingException extends RuntimeException {

  public WebhookProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
