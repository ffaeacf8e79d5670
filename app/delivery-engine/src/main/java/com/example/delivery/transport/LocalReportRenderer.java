/*
 * どこで: レポートのレンダリング
 * 何を: 既知のテンプレート種別についてヘッダのみの区切り文書を出力する
 * なぜ: レポート用 DB なしで定期ジョブをエンドツーエンドで動かすため
 */
package com.example.delivery.transport;

import com.example.delivery.model.FilterExpression;
import com.example.delivery.model.RenderSpec;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalReportRenderer implements ReportRenderer {

  private static final Logger logger = LoggerFactory.getLogger(LocalReportRenderer.class);

  private static final Map<String, List<String>> DEFAULT_COLUMNS =
      Map.of(
          "candidates", List.of("candidate_id", "name", "status", "created_at"),
          "interviews", List.of("interview_id", "candidate_id", "scheduled_at", "status"),
          "hiring_funnel", List.of("stage", "count", "conversion_rate"),
          "time_to_hire", List.of("job_id", "average_days", "median_days"),
          "source_effectiveness", List.of("source", "applicants", "hires"),
          "compliance_summary", List.of("metric", "value", "threshold"),
          "billing", List.of("invoice_id", "amount", "status"));

  @Override
  public RenderedArtifact render(RenderSpec spec) {
    final List<String> known = DEFAULT_COLUMNS.get(spec.templateKind());
    if (known == null) {
      throw new RenderValidationException("unknown template kind: " + spec.templateKind());
    }
    final List<String> columns = spec.columns().isEmpty() ? known : spec.columns();
    final StringBuilder document = new StringBuilder();
    document.append("# ").append(spec.templateKind()).append('\n');
    for (FilterExpression filter : spec.filters()) {
      document
          .append("# filter ")
          .append(filter.field())
          .append(' ')
          .append(filter.operator())
          .append(' ')
          .append(String.join("|", filter.operands()))
          .append('\n');
    }
    document.append(String.join(",", columns)).append('\n');
    logger.info(
        "report simulated render templateKind={} format={} columns={}",
        spec.templateKind(),
        spec.format(),
        columns.size());
    return new RenderedArtifact(document.toString().getBytes(StandardCharsets.UTF_8), 0);
  }
}
