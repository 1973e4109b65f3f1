/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 期間計算とテストで同一の時刻注入を使うため
 */
package com.dentfinder.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
