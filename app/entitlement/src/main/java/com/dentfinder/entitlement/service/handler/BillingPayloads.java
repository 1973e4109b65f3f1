/*
 * どこで: Entitlement webhook ハンドラ補助
 * 何を: プロバイダのペイロードから識別子やメタデータを取り出して検証する
 * なぜ: 不正な識別子を DB へ渡す前に弾き、ハンドラを例外なしで no-op にするため
 */
package com.dentfinder.entitlement.service.handler;

import com.dentfinder.entitlement.model.FeaturedTier;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.regex.Pattern;

final class BillingPayloads {

  private static final Pattern PROVIDER_ID = Pattern.compile("[A-Za-z0-9_]{1,255}");
  private static final Pattern DIGITS = Pattern.compile("[0-9]{1,18}");

  private BillingPayloads() {}

  static Optional<String> text(JsonNode node, String field) {
    final JsonNode value = node.path(field);
    if (!value.isTextual() || value.asText().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.asText());
  }

  static Optional<String> metadata(JsonNode object, String key) {
    return text(object.path("metadata"), key);
  }

  /** 文字列 ID と展開済みオブジェクト ({"id": ...}) の両方を受け付ける。 */
  static Optional<String> providerId(JsonNode node, String field) {
    final JsonNode value = node.path(field);
    final String raw = value.isObject() ? value.path("id").asText("") : value.asText("");
    if (value.isNull() || !PROVIDER_ID.matcher(raw).matches()) {
      return Optional.empty();
    }
    return Optional.of(raw);
  }

  static OptionalLong storeId(String raw) {
    if (raw == null || !DIGITS.matcher(raw.trim()).matches()) {
      return OptionalLong.empty();
    }
    final long value = Long.parseLong(raw.trim());
    return value > 0 ? OptionalLong.of(value) : OptionalLong.empty();
  }

  static Optional<UUID> userId(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    try {
      final UUID parsed = UUID.fromString(raw.trim());
      // UUID.fromString は桁不足も受け付けるため正規形と突き合わせる
      return parsed.toString().equalsIgnoreCase(raw.trim()) ? Optional.of(parsed) : Optional.empty();
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }

  static Optional<FeaturedTier> tier(String raw) {
    return FeaturedTier.fromValue(raw);
  }

  static Optional<Instant> epochSeconds(JsonNode node, String field) {
    final JsonNode value = node.path(field);
    if (!value.canConvertToLong() || !value.isIntegralNumber()) {
      return Optional.empty();
    }
    return Optional.of(Instant.ofEpochSecond(value.asLong()));
  }
}
