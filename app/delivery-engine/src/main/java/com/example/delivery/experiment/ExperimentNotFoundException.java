package com.example.delivery.experiment;

import java.util.UUID;

public class ExperimentNotFoundException extends RuntimeException {

  public ExperimentNotFoundException(UUID experimentId) {
    super("experiment not found experimentId=" + experimentId);
  }
}
