/*
 * どこで: レポートのメール送信
 * 何を: アドレスを検証し、送信せずにログへ出すメーラー
 * なぜ: SMTP サーバーなしで受信者ごとの成功と失敗を確認できるようにするため
 */
package com.example.delivery.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalReportMailer implements ReportMailer {

  private static final Logger logger = LoggerFactory.getLogger(LocalReportMailer.class);

  @Override
  public void send(ReportMail mail) {
    final String recipient = mail.recipient();
    final int at = recipient == null ? -1 : recipient.indexOf('@');
    if (at <= 0 || at == recipient.length() - 1) {
      throw new IllegalArgumentException("invalid recipient address: " + recipient);
    }
    logger.info(
        "report mail simulated send recipient={} fileName={} location={}",
        recipient,
        mail.fileName(),
        mail.artifactLocation());
  }
}
