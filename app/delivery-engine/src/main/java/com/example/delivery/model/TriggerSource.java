package com.example.delivery.model;

public enum TriggerSource {
  SCHEDULE,
  MANUAL
}
