/*
 * どこで: Entitlement Web 補助
 * 何を: プロキシ経由のリクエストから送信元 IP を取り出す
 * なぜ: MDC とレート制限で同じ送信元判定を使うため
 */
package com.dentfinder.entitlement.config;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientIpResolver {

  private ClientIpResolver() {}

  // X-Forwarded-For の先頭、X-Real-IP、接続元アドレスの順に採用する
  public static String resolve(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor != null && !xForwardedFor.isBlank()) {
      final int commaIndex = xForwardedFor.indexOf(',');
      return commaIndex < 0
          ? xForwardedFor.trim()
          : xForwardedFor.substring(0, commaIndex).trim();
    }
    final String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    return request.getRemoteAddr();
  }
}
