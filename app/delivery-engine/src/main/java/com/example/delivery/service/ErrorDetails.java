package com.example.delivery.service;

import com.google.common.base.Throwables;

/** run と配信レコードに保存する長さ上限付きのエラー文字列。 */
final class ErrorDetails {

  private ErrorDetails() {}

  static String message(Throwable error, int maxLength) {
    final String message = error.getMessage();
    final String text =
        message == null || message.isBlank()
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + message;
    return truncate(text, maxLength);
  }

  static String stackTrace(Throwable error, int maxLength) {
    return truncate(Throwables.getStackTraceAsString(error), maxLength);
  }

  static String truncate(String text, int maxLength) {
    if (text == null || text.length() <= maxLength) {
      return text;
    }
    return text.substring(0, maxLength);
  }
}
