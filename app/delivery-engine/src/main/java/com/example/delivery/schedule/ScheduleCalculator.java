/*
 * どこで: スケジュール計算
 * 何を: 基準時刻より厳密に後の次回実行時刻を cadence から求める
 * なぜ: 月/週/DST をまたいでも定期エクスポートやレポートを飛ばしたり二重起動したりしないため
 */
package com.example.delivery.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

/**
 * 役割: 副作用のない次回実行時刻の計算。
 * 動作: 壁時計の値は cadence のタイムゾーンで解決し、すぐに {@link Instant} へ変換する。比較は常に UTC の時間軸で行う。
 *
 * <p>夏時間のギャップに入るローカル時刻はギャップの長さだけ後ろへずらし、重複区間のローカル時刻は早い方のオフセットで解決する。どちらも {@link
 * ZonedDateTime#of(LocalDate, LocalTime, ZoneId)} の挙動に従う。
 */
@Component
public class ScheduleCalculator {

  private static final int MONTHS_PER_QUARTER = 3;

  public Instant nextRun(CadenceSpec spec, Instant reference) {
    final Instant next =
        switch (spec.cadence()) {
          case DAILY -> nextDaily(spec, reference);
          case WEEKLY -> nextWeekly(spec, reference);
          case MONTHLY -> nextMonthly(spec, reference);
          case QUARTERLY -> nextQuarterly(spec, reference);
          case CUSTOM -> nextCustom(spec, reference);
        };
    if (!next.isAfter(reference)) {
      throw new IllegalStateException(
          "next run " + next + " is not after reference " + reference + " for " + spec);
    }
    return next;
  }

  private Instant nextDaily(CadenceSpec spec, Instant reference) {
    final LocalDate today = reference.atZone(spec.timezone()).toLocalDate();
    final Instant candidate = at(today, spec);
    if (candidate.isAfter(reference)) {
      return candidate;
    }
    return at(today.plusDays(1), spec);
  }

  private Instant nextWeekly(CadenceSpec spec, Instant reference) {
    final LocalDate today = reference.atZone(spec.timezone()).toLocalDate();
    // 両辺とも ISO 値 (月曜=1..日曜=7) なので、7 の剰余が前方向の日数になる
    final int daysAhead =
        Math.floorMod(spec.dayOfWeek().getValue() - today.getDayOfWeek().getValue(), 7);
    final LocalDate targetDate = today.plusDays(daysAhead);
    final Instant candidate = at(targetDate, spec);
    if (candidate.isAfter(reference)) {
      return candidate;
    }
    return at(targetDate.plusWeeks(1), spec);
  }

  private Instant nextMonthly(CadenceSpec spec, Instant reference) {
    final YearMonth month = YearMonth.from(reference.atZone(spec.timezone()));
    final Instant candidate = at(clampDay(month, spec.dayOfMonth()), spec);
    if (candidate.isAfter(reference)) {
      return candidate;
    }
    return at(clampDay(month.plusMonths(1), spec.dayOfMonth()), spec);
  }

  private Instant nextQuarterly(CadenceSpec spec, Instant reference) {
    final ZonedDateTime local = reference.atZone(spec.timezone());
    final int quarterStartMonth =
        ((local.getMonthValue() - 1) / MONTHS_PER_QUARTER) * MONTHS_PER_QUARTER + 1;
    LocalDate boundary = LocalDate.of(local.getYear(), quarterStartMonth, 1);
    Instant candidate = at(boundary, spec);
    while (!candidate.isAfter(reference)) {
      boundary = boundary.plusMonths(MONTHS_PER_QUARTER);
      candidate = at(boundary, spec);
    }
    return candidate;
  }

  private Instant nextCustom(CadenceSpec spec, Instant reference) {
    final CronExpression cron;
    try {
      cron = CronExpression.parse(spec.cronExpression());
    } catch (IllegalArgumentException ex) {
      throw new InvalidCadenceException("invalid cron expression: " + spec.cronExpression(), ex);
    }
    final ZonedDateTime next = cron.next(reference.atZone(spec.timezone()));
    if (next == null) {
      throw new InvalidCadenceException("cron expression never fires: " + spec.cronExpression());
    }
    return next.toInstant();
  }

  private static LocalDate clampDay(YearMonth month, int dayOfMonth) {
    return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
  }

  private static Instant at(LocalDate date, CadenceSpec spec) {
    return ZonedDateTime.of(date, spec.timeOfDay(), spec.timezone()).toInstant();
  }
}
