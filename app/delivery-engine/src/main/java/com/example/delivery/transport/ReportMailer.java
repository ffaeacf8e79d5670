package com.example.delivery.transport;

/** レンダリング済み成果物を受信者 1 人へ送る。送れない受信者なら例外を送出する。 */
public interface ReportMailer {

  void send(ReportMail mail);
}
