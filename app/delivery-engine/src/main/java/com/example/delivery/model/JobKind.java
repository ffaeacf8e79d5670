package com.example.delivery.model;

public enum JobKind {
  EXPORT,
  REPORT
}
