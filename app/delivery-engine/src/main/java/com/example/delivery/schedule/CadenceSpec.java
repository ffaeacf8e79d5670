/*
 * どこで: スケジュールのモデル
 * 何を: 不変の cadence 記述子 (種別 + パラメータ + タイムゾーン)
 * なぜ: 生成時に一度だけ検証し、計算処理に不正な cadence を渡さないため
 */
package com.example.delivery.schedule;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.scheduling.support.CronExpression;

public record CadenceSpec(
    Cadence cadence,
    LocalTime timeOfDay,
    DayOfWeek dayOfWeek,
    Integer dayOfMonth,
    String cronExpression,
    ZoneId timezone) {

  private static final int UNIX_CRON_FIELDS = 5;

  public CadenceSpec {
    if (cadence == null) {
      throw new InvalidCadenceException("cadence is required");
    }
    if (timezone == null) {
      throw new InvalidCadenceException("timezone is required");
    }
    switch (cadence) {
      case DAILY, QUARTERLY -> requireTime(cadence, timeOfDay);
      case WEEKLY -> {
        requireTime(cadence, timeOfDay);
        if (dayOfWeek == null) {
          throw new InvalidCadenceException("weekly cadence requires day-of-week");
        }
      }
      case MONTHLY -> {
        requireTime(cadence, timeOfDay);
        if (dayOfMonth == null || dayOfMonth < 1 || dayOfMonth > 31) {
          throw new InvalidCadenceException("monthly cadence requires day-of-month 1..31 but was " + dayOfMonth);
        }
      }
      case CUSTOM -> {
        if (cronExpression == null || cronExpression.isBlank()) {
          throw new InvalidCadenceException("custom cadence requires a cron expression");
        }
        cronExpression = normalizeCron(cronExpression);
        if (!CronExpression.isValidExpression(cronExpression)) {
          throw new InvalidCadenceException("invalid cron expression: " + cronExpression);
        }
      }
    }
  }

  public static CadenceSpec daily(LocalTime timeOfDay, ZoneId timezone) {
    return new CadenceSpec(Cadence.DAILY, timeOfDay, null, null, null, timezone);
  }

  public static CadenceSpec weekly(DayOfWeek dayOfWeek, LocalTime timeOfDay, ZoneId timezone) {
    return new CadenceSpec(Cadence.WEEKLY, timeOfDay, dayOfWeek, null, null, timezone);
  }

  public static CadenceSpec monthly(int dayOfMonth, LocalTime timeOfDay, ZoneId timezone) {
    return new CadenceSpec(Cadence.MONTHLY, timeOfDay, null, dayOfMonth, null, timezone);
  }

  public static CadenceSpec quarterly(LocalTime timeOfDay, ZoneId timezone) {
    return new CadenceSpec(Cadence.QUARTERLY, timeOfDay, null, null, null, timezone);
  }

  public static CadenceSpec custom(String cronExpression, ZoneId timezone) {
    return new CadenceSpec(Cadence.CUSTOM, null, null, null, cronExpression, timezone);
  }

  private static void requireTime(Cadence cadence, LocalTime timeOfDay) {
    if (timeOfDay == null) {
      throw new InvalidCadenceException(cadence.name().toLowerCase() + " cadence requires time-of-day");
    }
  }

  // Spring の cron は先頭に秒フィールドを持つ。従来の 5 フィールド形式も受け付ける
  private static String normalizeCron(String expression) {
    final String trimmed = expression.trim();
    if (trimmed.split("\\s+").length == UNIX_CRON_FIELDS) {
      return "0 " + trimmed;
    }
    return trimmed;
  }
}
