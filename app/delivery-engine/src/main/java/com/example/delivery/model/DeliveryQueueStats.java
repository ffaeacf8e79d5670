package com.example.delivery.model;

public record DeliveryQueueStats(
    long total, long queued, long processing, long sent, long failed, long cancelled) {}
