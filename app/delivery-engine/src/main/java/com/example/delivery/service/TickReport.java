package com.example.delivery.service;

/** 1 回の tick の処理結果。ログとテストで使う。 */
public record TickReport(
    int jobsCompleted,
    int jobsFailed,
    int jobsSkipped,
    int deliveriesSent,
    int deliveriesRequeued,
    int deliveriesFailed,
    int deliveriesSkipped,
    int leasesRecovered,
    int winnersDeclared) {}
