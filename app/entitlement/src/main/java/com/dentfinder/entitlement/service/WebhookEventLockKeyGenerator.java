/*
 * どこで: Entitlement サービス補助
 * 何を: webhook イベント ID から 64-bit advisory lock のキーを生成する
 * なぜ: hashtext(32-bit) の衝突による不要な直列化を避けるため
 */
package com.dentfinder.entitlement.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class WebhookEventLockKeyGenerator {

  // 64-bit advisory lock 用に SHA-256 の先頭 8byte を使う。
  static final int LOCK_KEY_BYTES = 8;

  public long generate(String eventId) {
    final byte[] hashed = hash(eventId);
    // ByteBuffer は Big Endian が既定。他言語からロックを取る場合も同じ値になる。
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String eventId) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(eventId.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      // JVM が SHA-256 を提供しない場合は実行環境の前提が崩れているため即失敗させる。
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
