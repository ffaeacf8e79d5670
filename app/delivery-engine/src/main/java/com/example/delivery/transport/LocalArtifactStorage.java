/*
 * どこで: 成果物ストレージ
 * 何を: オブジェクトキーを反映したパスでローカルのベースディレクトリ配下に書き込む
 * なぜ: 同じキー構成のままオブジェクトストレージの代わりに使うため
 */
package com.example.delivery.transport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LocalArtifactStorage implements ArtifactStorage {

  private static final Logger logger = LoggerFactory.getLogger(LocalArtifactStorage.class);

  private final ArtifactStorageProperties properties;

  @Override
  public String store(String key, byte[] content, String contentType) {
    final Path base = properties.baseDir().toAbsolutePath().normalize();
    final Path target = base.resolve(key).normalize();
    if (!target.startsWith(base)) {
      throw new IllegalArgumentException("artifact key escapes the storage directory: " + key);
    }
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, content);
    } catch (IOException e) {
      throw new UncheckedIOException("failed to store artifact key=" + key, e);
    }
    logger.info("artifact stored key={} size={} contentType={}", key, content.length, contentType);
    return target.toUri().toString();
  }
}
