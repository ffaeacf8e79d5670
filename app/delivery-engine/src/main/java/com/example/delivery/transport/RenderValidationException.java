/*
 * どこで: レポートのレンダリング
 * 何を: 決して成功しないレンダリング要求 (未知のテンプレート種別、未対応カラム)
 * なぜ: 恒久的な検証エラーと一時的なレンダリングエラーを区別するため
 */
package com.example.delivery.transport;

public class RenderValidationException extends RuntimeException {

  public RenderValidationException(String message) {
    super(message);
  }
}
