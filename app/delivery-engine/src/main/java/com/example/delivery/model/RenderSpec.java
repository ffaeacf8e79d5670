/*
 * どこで: レンダリングのモデル
 * 何を: 定期ジョブ 1 件分のレンダリング引数
 * なぜ: テンプレート種別/フィルタ/カラム/形式をまとめて運び、一度だけ検証するため
 */
package com.example.delivery.model;

import java.util.List;

public record RenderSpec(
    String templateKind, List<FilterExpression> filters, List<String> columns, ExportFormat format) {

  public RenderSpec {
    if (templateKind == null || templateKind.isBlank()) {
      throw new IllegalArgumentException("template kind is required");
    }
    if (format == null) {
      throw new IllegalArgumentException("export format is required");
    }
    filters = filters == null ? List.of() : List.copyOf(filters);
    columns = columns == null ? List.of() : List.copyOf(columns);
  }
}
