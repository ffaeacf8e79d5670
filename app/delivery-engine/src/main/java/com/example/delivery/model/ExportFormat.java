/*
 * どこで: レンダリングのモデル
 * 何を: レンダリング処理がサポートする出力形式
 * なぜ: 成果物のファイル名と Content-Type を形式から導出するため
 */
package com.example.delivery.model;

public enum ExportFormat {
  CSV("csv", "text/csv"),
  PDF("pdf", "application/pdf"),
  EXCEL("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

  private final String extension;
  private final String contentType;

  ExportFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }
}
