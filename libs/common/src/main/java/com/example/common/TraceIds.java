package com.example.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class TraceIds {
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 役割: locked_by カラムに書く識別子を解決する。
   * 動作: ホスト名を優先し、取れなければ代替値を使う。リース所有者が空にならないようにする。
   */
  public static String resolveWorkerId() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      return DEFAULT_HOSTNAME;
    }
  }
}
