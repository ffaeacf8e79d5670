/*
 * どこで: Delivery Engine のサービス層
 * 何を: 同じチャネルへの連続送信を一定間隔あける
 * なぜ: 下流プロバイダのチャネル単位レート制限を全ワーカースレッドで共有するため
 */
package com.example.delivery.service;

import com.example.delivery.config.DeliveryQueueProperties;
import com.example.delivery.model.DeliveryChannel;
import com.google.common.util.concurrent.RateLimiter;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

@Component
public class ChannelPacer {

  private final Map<DeliveryChannel, RateLimiter> limiters = new EnumMap<>(DeliveryChannel.class);

  public ChannelPacer(DeliveryQueueProperties properties) {
    final Duration interval = properties.channelSendInterval();
    if (interval.isZero() || interval.isNegative()) {
      return;
    }
    final double permitsPerSecond = (double) TimeUnit.SECONDS.toNanos(1) / interval.toNanos();
    for (DeliveryChannel channel : DeliveryChannel.values()) {
      limiters.put(channel, RateLimiter.create(permitsPerSecond));
    }
  }

  /** チャネルが使えるようになるまでブロックする。ペーシング無効時は即座に返る。 */
  public void acquire(DeliveryChannel channel) {
    final RateLimiter limiter = limiters.get(channel);
    if (limiter != null) {
      limiter.acquire();
    }
  }

  public boolean isEnabled() {
    return !limiters.isEmpty();
  }
}
