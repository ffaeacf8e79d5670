/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: スケジューリング判断がすべて同じ差し替え可能な時刻を読むため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
