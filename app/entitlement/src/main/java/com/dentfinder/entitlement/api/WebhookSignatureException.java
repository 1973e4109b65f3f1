/*
 * どこで: Entitlement API
 * 何を: webhook 署名の欠落/不一致を表す
 * なぜ: 認証失敗を副作用なしで 400 に変換するため
 */
package com.dentfinder.entitlement.api;

public class WebhookSignatureException extends RuntimeException {

  public WebhookSignatureException(String message) {
    super(message);
  }

  public WebhookSignatureException(String message, Throwable cause) {
    super(message, cause);
  }
}
