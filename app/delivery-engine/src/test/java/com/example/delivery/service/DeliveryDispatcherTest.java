/*
 * どこで: 配信ディスパッチャの単体テスト
 * 何を: チャネル展開、部分配信の追跡、トランスポート結果ごとの結果選択を検証する
 * なぜ: 成功済みのチャネルをリトライで再送してはならないため
 */
package com.example.delivery.service;

import static com.example.delivery.service.ServiceFixtures.EXECUTOR_PROPERTIES;
import static com.example.delivery.service.ServiceFixtures.QUEUE_PROPERTIES;
import static com.example.delivery.service.ServiceFixtures.delivery;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.delivery.model.DeliveryChannel;
import com.example.delivery.model.DeliveryMethod;
import com.example.delivery.model.DeliveryOutcome;
import com.example.delivery.model.DeliveryStatus;
import com.example.delivery.model.OutcomeTransition;
import com.example.delivery.model.QueuedDelivery;
import com.example.delivery.transport.DeliveryTransport;
import com.example.delivery.transport.PermanentDeliveryException;
import com.example.delivery.transport.TransportPayload;
import com.example.delivery.transport.TransportResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeliveryDispatcherTest {

  private static final Instant NOW = Instant.parse("2026-04-01T10:00:00Z");

  @Mock private DeliveryQueue deliveryQueue;
  @Mock private DeliveryTransport transport;

  private SimpleMeterRegistry meterRegistry;
  private DeliveryDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    dispatcher =
        new DeliveryDispatcher(
            deliveryQueue,
            transport,
            new ChannelPacer(QUEUE_PROPERTIES),
            new DeliveryEngineMetrics(meterRegistry),
            EXECUTOR_PROPERTIES);
  }

  @Test
  void onlyRemainingChannelsAreSentAndDeliveryCompletes() {
    final UUID deliveryId = UUID.randomUUID();
    claim(deliveryId, DeliveryMethod.PUSH_EMAIL, Set.of(DeliveryChannel.EMAIL));
    when(transport.deliver(eq("recipient-1"), eq(DeliveryChannel.PUSH), any(TransportPayload.class)))
        .thenReturn(TransportResult.DELIVERED);
    when(deliveryQueue.recordChannelDelivered(eq(deliveryId), eq(DeliveryChannel.PUSH), anyString(), eq(NOW)))
        .thenReturn(true);
    when(deliveryQueue.markOutcome(eq(deliveryId), eq(DeliveryOutcome.SENT), isNull(), anyString(), eq(NOW)))
        .thenReturn(OutcomeTransition.SENT);

    final DispatchResult result = dispatcher.dispatch(deliveryId, NOW);

    assertThat(result).isEqualTo(DispatchResult.SENT);
    verify(transport, never()).deliver(anyString(), eq(DeliveryChannel.EMAIL), any());
    assertThat(sentCount("sent")).isEqualTo(1.0d);
  }

  @Test
  void bounceFailsTheDelivery() {
    final UUID deliveryId = UUID.randomUUID();
    claim(deliveryId, DeliveryMethod.EMAIL, Set.of());
    when(transport.deliver(anyString(), eq(DeliveryChannel.EMAIL), any())).thenReturn(TransportResult.BOUNCED);
    when(deliveryQueue.markOutcome(
            eq(deliveryId), eq(DeliveryOutcome.BOUNCED), eq("bounced on channel EMAIL"), anyString(), eq(NOW)))
        .thenReturn(OutcomeTransition.FAILED);

    assertThat(dispatcher.dispatch(deliveryId, NOW)).isEqualTo(DispatchResult.FAILED);
    assertThat(sentCount("bounced")).isEqualTo(1.0d);
    verify(deliveryQueue, never()).recordChannelDelivered(any(), any(), any(), any());
  }

  @Test
  void throttledChannelIsRetried() {
    final UUID deliveryId = UUID.randomUUID();
    claim(deliveryId, DeliveryMethod.PUSH, Set.of());
    when(transport.deliver(anyString(), eq(DeliveryChannel.PUSH), any())).thenReturn(TransportResult.THROTTLED);
    when(deliveryQueue.markOutcome(
            eq(deliveryId), eq(DeliveryOutcome.RETRYABLE_FAILURE), eq("throttled on channel PUSH"), anyString(),
            eq(NOW)))
        .thenReturn(OutcomeTransition.REQUEUED);

    assertThat(dispatcher.dispatch(deliveryId, NOW)).isEqualTo(DispatchResult.REQUEUED);
  }

  @Test
  void permanentTransportErrorFailsImmediately() {
    final UUID deliveryId = UUID.randomUUID();
    claim(deliveryId, DeliveryMethod.SMS, Set.of());
    when(transport.deliver(anyString(), eq(DeliveryChannel.SMS), any()))
        .thenThrow(new PermanentDeliveryException("number disconnected"));
    when(deliveryQueue.markOutcome(
            eq(deliveryId),
            eq(DeliveryOutcome.PERMANENT_FAILURE),
            eq("PermanentDeliveryException: number disconnected"),
            anyString(),
            eq(NOW)))
        .thenReturn(OutcomeTransition.FAILED);

    assertThat(dispatcher.dispatch(deliveryId, NOW)).isEqualTo(DispatchResult.FAILED);
  }

  @Test
  void transientErrorAfterPartialSuccessKeepsDeliveredChannel() {
    final UUID deliveryId = UUID.randomUUID();
    claim(deliveryId, DeliveryMethod.PUSH_SMS, Set.of());
    when(transport.deliver(anyString(), eq(DeliveryChannel.PUSH), any())).thenReturn(TransportResult.DELIVERED);
    when(transport.deliver(anyString(), eq(DeliveryChannel.SMS), any()))
        .thenThrow(new IllegalStateException("gateway timeout"));
    when(deliveryQueue.recordChannelDelivered(eq(deliveryId), eq(DeliveryChannel.PUSH), anyString(), eq(NOW)))
        .thenReturn(true);
    when(deliveryQueue.markOutcome(
            eq(deliveryId), eq(DeliveryOutcome.RETRYABLE_FAILURE), anyString(), anyString(), eq(NOW)))
        .thenReturn(OutcomeTransition.REQUEUED);

    assertThat(dispatcher.dispatch(deliveryId, NOW)).isEqualTo(DispatchResult.REQUEUED);
    verify(deliveryQueue).recordChannelDelivered(eq(deliveryId), eq(DeliveryChannel.PUSH), anyString(), eq(NOW));
  }

  @Test
  void contendedClaimIsSkipped() {
    final UUID deliveryId = UUID.randomUUID();
    when(deliveryQueue.markProcessing(eq(deliveryId), anyString(), eq(NOW))).thenReturn(false);

    assertThat(dispatcher.dispatch(deliveryId, NOW)).isEqualTo(DispatchResult.SKIPPED);
    verifyNoInteractions(transport);
    assertThat(sentCount("contended")).isEqualTo(1.0d);
  }

  @Test
  void unexpectedErrorLeavesDeliveryForLeaseRecovery() {
    final UUID deliveryId = UUID.randomUUID();
    claim(deliveryId, DeliveryMethod.PUSH, Set.of());
    when(transport.deliver(anyString(), any(), any())).thenReturn(TransportResult.DELIVERED);
    when(deliveryQueue.recordChannelDelivered(any(), any(), anyString(), any())).thenReturn(true);
    when(deliveryQueue.markOutcome(any(), any(), any(), anyString(), any()))
        .thenThrow(new IllegalStateException("db down"));

    assertThat(dispatcher.dispatch(deliveryId, NOW)).isEqualTo(DispatchResult.SKIPPED);
    assertThat(sentCount("error")).isEqualTo(1.0d);
  }

  @Test
  void concurrentDispatchersSendADeliveryOnlyOnce() throws Exception {
    final UUID deliveryId = UUID.randomUUID();
    final AtomicBoolean claimed = new AtomicBoolean();
    doAnswer(invocation -> claimed.compareAndSet(false, true))
        .when(deliveryQueue)
        .markProcessing(eq(deliveryId), anyString(), eq(NOW));
    when(deliveryQueue.get(deliveryId))
        .thenReturn(
            delivery(deliveryId, DeliveryStatus.PROCESSING, 1, "worker", DeliveryMethod.EMAIL, Set.of(), null, null));
    when(transport.deliver(anyString(), eq(DeliveryChannel.EMAIL), any())).thenReturn(TransportResult.DELIVERED);
    when(deliveryQueue.recordChannelDelivered(eq(deliveryId), eq(DeliveryChannel.EMAIL), anyString(), eq(NOW)))
        .thenReturn(true);
    when(deliveryQueue.markOutcome(eq(deliveryId), eq(DeliveryOutcome.SENT), isNull(), anyString(), eq(NOW)))
        .thenReturn(OutcomeTransition.SENT);

    final int workers = 8;
    final ExecutorService pool = Executors.newFixedThreadPool(workers);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<DispatchResult>> futures = new ArrayList<>();
      for (int i = 0; i < workers; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  return dispatcher.dispatch(deliveryId, NOW);
                }));
      }
      start.countDown();
      final List<DispatchResult> results = new ArrayList<>();
      for (Future<DispatchResult> future : futures) {
        results.add(future.get(10, TimeUnit.SECONDS));
      }

      assertThat(results).filteredOn(r -> r == DispatchResult.SENT).hasSize(1);
      assertThat(results).filteredOn(r -> r == DispatchResult.SKIPPED).hasSize(workers - 1);
    } finally {
      pool.shutdownNow();
    }
    verify(transport, times(1)).deliver(anyString(), eq(DeliveryChannel.EMAIL), any());
    verify(deliveryQueue, times(1)).markOutcome(any(), any(), any(), anyString(), any());
    assertThat(sentCount("contended")).isEqualTo(workers - 1.0d);
  }

  private void claim(UUID deliveryId, DeliveryMethod method, Set<DeliveryChannel> delivered) {
    final QueuedDelivery claimed =
        delivery(deliveryId, DeliveryStatus.PROCESSING, 1, "worker", method, delivered, null, null);
    when(deliveryQueue.markProcessing(eq(deliveryId), anyString(), eq(NOW))).thenReturn(true);
    when(deliveryQueue.get(deliveryId)).thenReturn(claimed);
  }

  private double sentCount(String result) {
    return meterRegistry.get("delivery_engine.delivery.total").tag("result", result).counter().count();
  }
}
