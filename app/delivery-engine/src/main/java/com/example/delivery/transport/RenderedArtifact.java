package com.example.delivery.transport;

import java.util.Arrays;

/** レンダリング済みのエクスポート/レポートのバイト列と、含まれるデータ件数。 */
public record RenderedArtifact(byte[] content, int recordCount) {

  public RenderedArtifact {
    content = content == null ? new byte[0] : content.clone();
  }

  @Override
  public byte[] content() {
    return content.clone();
  }

  public long size() {
    return content.length;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RenderedArtifact)) {
      return false;
    }
    final RenderedArtifact that = (RenderedArtifact) other;
    return recordCount == that.recordCount && Arrays.equals(content, that.content);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(content) + recordCount;
  }

  @Override
  public String toString() {
    return "RenderedArtifact[size=" + content.length + ", recordCount=" + recordCount + "]";
  }
}
