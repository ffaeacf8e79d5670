/*
 * どこで: スケジュールのモデル
 * 何を: 数値の曜日入力を java.time.DayOfWeek に正規化する
 * なぜ: 呼び出し側が月曜始まり (ISO 1..7) と日曜始まり (0..6) の両方を使うため
 */
package com.example.delivery.schedule;

import java.time.DayOfWeek;

public enum DayOfWeekConvention {

  /** 月曜=1 .. 日曜=7。 */
  ISO {
    @Override
    public DayOfWeek toDayOfWeek(int value) {
      if (value < 1 || value > 7) {
        throw new InvalidCadenceException("ISO day-of-week must be 1..7 but was " + value);
      }
      return DayOfWeek.of(value);
    }

    @Override
    public int fromDayOfWeek(DayOfWeek dayOfWeek) {
      return dayOfWeek.getValue();
    }
  },

  /** 日曜=0 .. 土曜=6。cron や多くの JavaScript の日付 API と同じ。 */
  SUNDAY_FIRST {
    @Override
    public DayOfWeek toDayOfWeek(int value) {
      if (value < 0 || value > 6) {
        throw new InvalidCadenceException("Sunday-first day-of-week must be 0..6 but was " + value);
      }
      return value == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(value);
    }

    @Override
    public int fromDayOfWeek(DayOfWeek dayOfWeek) {
      return dayOfWeek.getValue() % 7;
    }
  };

  public abstract DayOfWeek toDayOfWeek(int value);

  public abstract int fromDayOfWeek(DayOfWeek dayOfWeek);
}
