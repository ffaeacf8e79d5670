/*
 * どこで: Delivery Engine のエントリポイント
 * 何を: Spring を起動し、設定プロパティのスキャンとスケジューリングを有効化する
 * なぜ: tick ワーカーとプロパティレコードを一箇所で有効化するため
 */
package com.example.delivery;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DeliveryEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeliveryEngineApplication.class, args);
  }
}
