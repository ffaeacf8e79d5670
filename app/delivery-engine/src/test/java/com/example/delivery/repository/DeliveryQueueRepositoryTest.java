/*
 * どこで: Delivery Engine のリポジトリテスト
 * 何を: Postgres 上で delivery_queue の取得/リース回収/終了遷移を検証する
 * なぜ: 同じ配信を 2 つのワーカーが送らないことを保証するのは条件付き更新だけのため
 */
package com.example.delivery.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.delivery.AbstractPostgresContainerTest;
import com.example.delivery.model.DeliveryChannel;
import com.example.delivery.model.DeliveryMethod;
import com.example.delivery.model.DeliveryPriority;
import com.example.delivery.model.DeliveryQueueStats;
import com.example.delivery.model.DeliveryStatsFilter;
import com.example.delivery.model.DeliveryStatus;
import com.example.delivery.model.NotificationType;
import com.example.delivery.model.QueuedDelivery;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeliveryQueueRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-04-01T10:00:00Z");
  private static final Duration LEASE = Duration.ofMinutes(5);

  @Autowired private DeliveryQueueRepository repository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM delivery_queue", new MapSqlParameterSource());
  }

  @Test
  void findDueOrdersByPriorityThenScheduleAndSkipsFutureRows() {
    final UUID lowOld = repository.insert(queued("u_1", DeliveryPriority.LOW, NOW.minusSeconds(600)));
    final UUID urgent = repository.insert(queued("u_2", DeliveryPriority.URGENT, NOW.minusSeconds(10)));
    final UUID mediumOld = repository.insert(queued("u_3", DeliveryPriority.MEDIUM, NOW.minusSeconds(300)));
    final UUID mediumNew = repository.insert(queued("u_4", DeliveryPriority.MEDIUM, NOW.minusSeconds(60)));
    repository.insert(queued("u_5", DeliveryPriority.URGENT, NOW.plusSeconds(60)));

    final List<QueuedDelivery> due = repository.findDue(NOW, 10);

    assertThat(due)
        .extracting(QueuedDelivery::deliveryId)
        .containsExactly(urgent, mediumOld, mediumNew, lowOld);
    assertThat(repository.findDue(NOW, 2)).hasSize(2);
    assertThat(repository.countDue(NOW)).isEqualTo(4);
  }

  @Test
  void insertedRowRoundTripsJsonColumns() {
    final QueuedDelivery original =
        withChannels(queued("u_1", DeliveryPriority.HIGH, NOW), Set.of(DeliveryChannel.EMAIL));
    repository.insert(original);

    final QueuedDelivery loaded = repository.findById(original.deliveryId()).orElseThrow();

    assertThat(loaded.deliveredChannels()).containsExactly(DeliveryChannel.EMAIL);
    assertThat(loaded.deliveryMethod()).isEqualTo(DeliveryMethod.PUSH_EMAIL);
    assertThat(loaded.scheduledFor()).isEqualTo(NOW);
    assertThat(loaded.metadataJson()).contains("\"campaign\"");
  }

  @Test
  void concurrentClaimsLetExactlyOneWorkerWin() throws Exception {
    final UUID deliveryId = repository.insert(queued("u_1", DeliveryPriority.MEDIUM, NOW));
    final int workers = 8;
    final ExecutorService pool = Executors.newFixedThreadPool(workers);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<Integer>> results = new ArrayList<>();
      for (int i = 0; i < workers; i++) {
        final String lockedBy = "worker-" + i;
        final Callable<Integer> claim =
            () -> {
              start.await();
              return repository.markProcessing(deliveryId, NOW, NOW.plus(LEASE), lockedBy);
            };
        results.add(pool.submit(claim));
      }
      start.countDown();
      int winners = 0;
      for (Future<Integer> result : results) {
        winners += result.get(10, TimeUnit.SECONDS);
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }

    final QueuedDelivery claimed = repository.findById(deliveryId).orElseThrow();
    assertThat(claimed.status()).isEqualTo(DeliveryStatus.PROCESSING);
    assertThat(claimed.attemptCount()).isEqualTo(1);
    assertThat(claimed.lockedBy()).startsWith("worker-");
    assertThat(claimed.leaseUntil()).isEqualTo(NOW.plus(LEASE));
  }

  @Test
  void requeuedRowIsNotDueUntilItsBackoffElapses() {
    final UUID deliveryId = repository.insert(queued("u_1", DeliveryPriority.MEDIUM, NOW));
    repository.markProcessing(deliveryId, NOW, NOW.plus(LEASE), "w1");

    final int updated =
        repository.markRequeued(deliveryId, NOW.plusSeconds(30), "timeout", NOW, "w1");

    assertThat(updated).isEqualTo(1);
    assertThat(repository.findDue(NOW.plusSeconds(29), 10)).isEmpty();
    assertThat(repository.markProcessing(deliveryId, NOW.plusSeconds(29), NOW.plus(LEASE), "w2"))
        .isZero();
    assertThat(repository.findDue(NOW.plusSeconds(30), 10)).hasSize(1);

    final QueuedDelivery requeued = repository.findById(deliveryId).orElseThrow();
    assertThat(requeued.scheduledFor()).isEqualTo(NOW);
    assertThat(requeued.lastError()).isEqualTo("timeout");
    assertThat(requeued.lockedBy()).isNull();
  }

  @Test
  void exitTransitionsRequireTheCurrentLockHolder() {
    final UUID deliveryId = repository.insert(queued("u_1", DeliveryPriority.MEDIUM, NOW));
    repository.markProcessing(deliveryId, NOW, NOW.plus(LEASE), "w1");

    assertThat(repository.markSent(deliveryId, NOW, "intruder")).isZero();
    assertThat(repository.markFailed(deliveryId, "x", NOW, "intruder")).isZero();
    assertThat(repository.addDeliveredChannel(deliveryId, DeliveryChannel.PUSH, "intruder", NOW))
        .isZero();

    assertThat(repository.markSent(deliveryId, NOW, "w1")).isEqualTo(1);
    assertThat(repository.markSent(deliveryId, NOW, "w1")).isZero();
    assertThat(repository.findById(deliveryId).orElseThrow().status()).isEqualTo(DeliveryStatus.SENT);
  }

  @Test
  void addDeliveredChannelRecordsEachChannelOnce() {
    final UUID deliveryId = repository.insert(queued("u_1", DeliveryPriority.MEDIUM, NOW));
    repository.markProcessing(deliveryId, NOW, NOW.plus(LEASE), "w1");

    assertThat(repository.addDeliveredChannel(deliveryId, DeliveryChannel.PUSH, "w1", NOW))
        .isEqualTo(1);
    assertThat(repository.addDeliveredChannel(deliveryId, DeliveryChannel.PUSH, "w1", NOW)).isZero();
    assertThat(repository.addDeliveredChannel(deliveryId, DeliveryChannel.EMAIL, "w1", NOW))
        .isEqualTo(1);

    assertThat(repository.findById(deliveryId).orElseThrow().deliveredChannels())
        .containsExactlyInAnyOrder(DeliveryChannel.PUSH, DeliveryChannel.EMAIL);
  }

  @Test
  void expiredLeasesReturnToQueueOrFailOnceAttemptsAreSpent() {
    final UUID retryable = repository.insert(queued("u_1", DeliveryPriority.MEDIUM, NOW));
    final UUID exhausted = repository.insert(queued("u_2", DeliveryPriority.MEDIUM, NOW));
    final UUID live = repository.insert(queued("u_3", DeliveryPriority.MEDIUM, NOW));
    repository.markProcessing(retryable, NOW, NOW.plusSeconds(60), "w1");
    repository.addDeliveredChannel(retryable, DeliveryChannel.PUSH, "w1", NOW);
    jdbcTemplate.update(
        "UPDATE delivery_queue SET attempt_count = 2 WHERE delivery_id = :id",
        new MapSqlParameterSource("id", exhausted));
    repository.markProcessing(exhausted, NOW, NOW.plusSeconds(60), "w2");
    repository.markProcessing(live, NOW, NOW.plusSeconds(600), "w3");

    final int recovered = repository.recoverExpiredLeases(NOW.plusSeconds(120), 3);

    assertThat(recovered).isEqualTo(2);
    final QueuedDelivery back = repository.findById(retryable).orElseThrow();
    assertThat(back.status()).isEqualTo(DeliveryStatus.QUEUED);
    assertThat(back.lockedBy()).isNull();
    assertThat(back.lastError()).isEqualTo("processing lease expired");
    assertThat(back.deliveredChannels()).containsExactly(DeliveryChannel.PUSH);
    assertThat(repository.findById(exhausted).orElseThrow().status())
        .isEqualTo(DeliveryStatus.FAILED);
    assertThat(repository.findById(live).orElseThrow().status())
        .isEqualTo(DeliveryStatus.PROCESSING);
  }

  @Test
  void cancelOnlyAffectsQueuedRows() {
    final UUID queued = repository.insert(queued("u_1", DeliveryPriority.MEDIUM, NOW));
    final UUID claimed = repository.insert(queued("u_2", DeliveryPriority.MEDIUM, NOW));
    repository.markProcessing(claimed, NOW, NOW.plus(LEASE), "w1");

    assertThat(repository.cancel(queued, NOW)).isEqualTo(1);
    assertThat(repository.cancel(queued, NOW)).isZero();
    assertThat(repository.cancel(claimed, NOW)).isZero();
    assertThat(repository.findById(queued).orElseThrow().status())
        .isEqualTo(DeliveryStatus.CANCELLED);
  }

  @Test
  void statsGroupByStatusAndHonorFilters() {
    repository.insert(withCampaign(queued("u_1", DeliveryPriority.MEDIUM, NOW), "spring"));
    final UUID sent = repository.insert(withCampaign(queued("u_2", DeliveryPriority.MEDIUM, NOW), "spring"));
    repository.insert(withCampaign(queued("u_1", DeliveryPriority.MEDIUM, NOW), "autumn"));
    repository.markProcessing(sent, NOW, NOW.plus(LEASE), "w1");
    repository.markSent(sent, NOW, "w1");

    final DeliveryQueueStats all = repository.stats(DeliveryStatsFilter.all());
    final DeliveryQueueStats spring =
        repository.stats(new DeliveryStatsFilter(null, "spring", null, null));
    final DeliveryQueueStats recipient =
        repository.stats(new DeliveryStatsFilter("u_1", null, null, null));
    final DeliveryQueueStats future =
        repository.stats(new DeliveryStatsFilter(null, null, NOW.plusSeconds(1), null));

    assertThat(all.total()).isEqualTo(3);
    assertThat(spring.total()).isEqualTo(2);
    assertThat(spring.sent()).isEqualTo(1);
    assertThat(spring.queued()).isEqualTo(1);
    assertThat(recipient.total()).isEqualTo(2);
    assertThat(future.total()).isZero();
  }

  private static QueuedDelivery queued(String recipientId, DeliveryPriority priority, Instant scheduledFor) {
    return new QueuedDelivery(
        UUID.randomUUID(),
        recipientId,
        NotificationType.INTERVIEW_REMINDER,
        "Interview tomorrow",
        "Your interview starts at 10:00",
        null,
        priority,
        DeliveryMethod.PUSH_EMAIL,
        scheduledFor,
        false,
        DeliveryStatus.QUEUED,
        0,
        null,
        null,
        null,
        Set.of(),
        null,
        null,
        null,
        null,
        "{\"campaign\":\"onboarding\"}",
        null,
        null,
        NOW,
        NOW);
  }

  private static QueuedDelivery withChannels(QueuedDelivery d, Set<DeliveryChannel> channels) {
    return new QueuedDelivery(
        d.deliveryId(), d.recipientId(), d.notificationType(), d.title(), d.message(), d.actionUrl(),
        d.priority(), d.deliveryMethod(), d.scheduledFor(), d.optimalSendTime(), d.status(),
        d.attemptCount(), d.lastAttemptAt(), d.nextAttemptAt(), d.lastError(), channels,
        d.experimentId(), d.variant(), d.campaignId(), d.userSegment(), d.metadataJson(),
        d.lockedBy(), d.leaseUntil(), d.createdAt(), d.updatedAt());
  }

  private static QueuedDelivery withCampaign(QueuedDelivery d, String campaignId) {
    return new QueuedDelivery(
        d.deliveryId(), d.recipientId(), d.notificationType(), d.title(), d.message(), d.actionUrl(),
        d.priority(), d.deliveryMethod(), d.scheduledFor(), d.optimalSendTime(), d.status(),
        d.attemptCount(), d.lastAttemptAt(), d.nextAttemptAt(), d.lastError(),
        d.deliveredChannels(), d.experimentId(), d.variant(), campaignId, d.userSegment(),
        d.metadataJson(), d.lockedBy(), d.leaseUntil(), d.createdAt(), d.updatedAt());
  }
}
