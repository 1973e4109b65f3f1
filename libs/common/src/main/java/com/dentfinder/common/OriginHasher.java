/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト送信元 (IP 等) を SHA-256 で不可逆なキーに変換する
 * なぜ: レート制限カウンタに生の IP を保存しないため
 */
package com.dentfinder.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class OriginHasher {

  /** 保存するハッシュの長さ (hex 文字数)。 */
  public static final int HASH_LENGTH = 32;

  private OriginHasher() {}

  /**
   * 送信元文字列をハッシュ化する。
   *
   * @param rawOrigin 送信元。null は空文字として扱う
   * @return SHA-256 hex の先頭 {@value #HASH_LENGTH} 文字
   */
  public static String hash(String rawOrigin) {
    final String value = rawOrigin == null ? "" : rawOrigin;
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      final byte[] hashed = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hashed).substring(0, HASH_LENGTH);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
