/*
 * どこで: Delivery Engine のデータアクセス
 * 何を: リスト/セットのカラムを jsonb テキストと相互変換する
 * なぜ: フィルタ/カラム/受信者/受信者ごとの結果を jsonb で保存するため
 */
package com.example.delivery.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JsonColumnCodec {

  private final ObjectMapper objectMapper;

  public String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize jsonb column", e);
    }
  }

  public <T> T read(String json, TypeReference<T> type) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to deserialize jsonb column", e);
    }
  }
}
