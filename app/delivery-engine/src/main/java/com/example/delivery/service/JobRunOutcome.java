package com.example.delivery.service;

public enum JobRunOutcome {
  COMPLETED,
  FAILED,
  /** リースが他で保持されているか、ジョブがもう期限到来していない。 */
  SKIPPED
}
