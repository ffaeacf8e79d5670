package com.example.delivery.transport;

import com.example.delivery.model.RenderSpec;

/** エクスポート/レポートの PDF/CSV/Excel レンダリング。 */
public interface ReportRenderer {

  /**
   * @throws RenderValidationException テンプレート種別またはカラムが未対応の場合
   */
  RenderedArtifact render(RenderSpec spec);
}
