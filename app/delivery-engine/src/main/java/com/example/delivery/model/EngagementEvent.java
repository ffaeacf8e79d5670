package com.example.delivery.model;

public enum EngagementEvent {
  OPENED,
  CLICKED,
  RESPONDED,
  CONVERTED
}
