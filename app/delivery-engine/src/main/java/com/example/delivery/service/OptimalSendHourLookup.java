package com.example.delivery.service;

import com.example.delivery.model.NotificationType;
import java.time.LocalTime;
import java.util.Optional;

/** 受信者に通知種別ごとに届きやすい過去の時刻。 */
public interface OptimalSendHourLookup {

  Optional<LocalTime> bestTime(String recipientId, NotificationType type);
}
