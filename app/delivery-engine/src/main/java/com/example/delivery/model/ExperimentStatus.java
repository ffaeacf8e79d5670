package com.example.delivery.model;

public enum ExperimentStatus {
  ACTIVE,
  COMPLETED
}
