package com.example.delivery.transport;

/** 保存済み成果物へのリンクを載せたメール 1 通。 */
public record ReportMail(
    String recipient, String subject, String fileName, String artifactLocation, String contentType) {}
