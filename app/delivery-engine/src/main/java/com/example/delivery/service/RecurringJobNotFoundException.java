package com.example.delivery.service;

import java.util.UUID;

public class RecurringJobNotFoundException extends RuntimeException {

  public RecurringJobNotFoundException(UUID jobId) {
    super("recurring job not found jobId=" + jobId);
  }
}
