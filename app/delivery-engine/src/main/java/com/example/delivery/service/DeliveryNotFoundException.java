package com.example.delivery.service;

import java.util.UUID;

public class DeliveryNotFoundException extends RuntimeException {

  public DeliveryNotFoundException(UUID deliveryId) {
    super("delivery not found deliveryId=" + deliveryId);
  }
}
