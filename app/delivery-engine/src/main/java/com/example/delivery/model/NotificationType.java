package com.example.delivery.model;

public enum NotificationType {
  INTERVIEW_REMINDER,
  FEEDBACK_REQUEST,
  CANDIDATE_RESPONSE,
  ENGAGEMENT_ALERT,
  AB_TEST_RESULT,
  SYSTEM_UPDATE,
  GENERAL
}
