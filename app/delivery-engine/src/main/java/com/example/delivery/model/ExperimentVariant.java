package com.example.delivery.model;

public enum ExperimentVariant {
  A,
  B
}
