package com.example.delivery.model;

public enum DeliveryChannel {
  PUSH,
  EMAIL,
  SMS
}
