/*
 * どこで: Entitlement API
 * 何を: CTA レート制限による拒否を表す
 * なぜ: 入力不正 (400) と区別して 429 を返すため
 */
package com.dentfinder.entitlement.api;

import com.dentfinder.entitlement.model.RateLimitScope;

public class RateLimitExceededException extends RuntimeException {

  private final RateLimitScope scope;

  public RateLimitExceededException(RateLimitScope scope) {
    // スコープはログのみに出し、クライアントには返さない
    super("rate limited");
    this.scope = scope;
  }

  public RateLimitScope scope() {
    return scope;
  }
}
