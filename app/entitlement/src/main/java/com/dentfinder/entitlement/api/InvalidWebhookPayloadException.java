/*
 * どこで: Entitlement API
 * 何を: 署名は正しいがイベントとして解釈できないペイロードを表す
 * なぜ: 再送しても直らない入力を 400 として返すため
 */
package com.dentfinder.entitlement.api;

public class InvalidWebhookPayloadException extends RuntimeException {

  public InvalidWebhookPayloadException(String message) {
    super(message);
  }

  public InvalidWebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
