package com.example.delivery.experiment;

/**
 * 標準正規分布の累積分布関数の閉形式近似 (Abramowitz and Stegun 26.2.17)。誤差はおよそ 1e-7。
 */
final class StandardNormal {

  private static final double P = 0.2316419d;
  private static final double DENSITY = 0.3989423d;
  private static final double B1 = 0.3193815d;
  private static final double B2 = -0.3565638d;
  private static final double B3 = 1.781478d;
  private static final double B4 = -1.821256d;
  private static final double B5 = 1.330274d;

  private StandardNormal() {}

  static double cdf(double x) {
    final double t = 1.0d / (1.0d + P * Math.abs(x));
    final double d = DENSITY * Math.exp(-x * x / 2.0d);
    final double tail = d * t * (B1 + t * (B2 + t * (B3 + t * (B4 + t * B5))));
    return x > 0 ? 1.0d - tail : tail;
  }

  /** z 統計量の両側 p 値。 */
  static double twoTailedPValue(double z) {
    final double p = 2.0d * (1.0d - cdf(Math.abs(z)));
    return Math.max(0.0d, Math.min(1.0d, p));
  }
}
