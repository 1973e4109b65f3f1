/*
 * どこで: Entitlement API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.dentfinder.entitlement.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    INVALID_SIGNATURE,
    STORE_NOT_FOUND,
    RATE_LIMITED,
    WEBHOOK_PROCESSING_FAILED
}
