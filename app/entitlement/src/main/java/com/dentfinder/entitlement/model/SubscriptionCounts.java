/*
 * どこで: Entitlement ドメインモデル
 * 何を: 状態別のサブスクリプション件数を保持する
 * なぜ: 運用画面の集計表示に必要な値をまとめて返すため
 */
package com.dentfinder.entitlement.model;

public record SubscriptionCounts(long active, long pastDue, long canceled, long total) {}
