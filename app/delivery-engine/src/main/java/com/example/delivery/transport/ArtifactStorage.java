package com.example.delivery.transport;

/** レンダリング済み成果物のオブジェクトストレージ。 */
public interface ArtifactStorage {

  /** キーの下にバイト列を保存し、受信者が使える場所を返す。 */
  String store(String key, byte[] content, String contentType);
}
