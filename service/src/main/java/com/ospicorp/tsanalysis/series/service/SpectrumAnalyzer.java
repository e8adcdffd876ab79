package com.ospicorp.tsanalysis.series.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Discrete Fourier transform helpers. Power-of-two lengths use an iterative radix-2 FFT, any
 * other length goes through Bluestein's chirp-z reformulation so every length runs in
 * O(n log n).
 */
public final class SpectrumAnalyzer {

  private SpectrumAnalyzer() {
  }

  public record Spectrum(List<Double> frequencies, List<Double> amplitudes) {}

  public static Spectrum magnitudeSpectrum(double[] samples, double sampleSpacing) {
    if (!(sampleSpacing > 0) || !Double.isFinite(sampleSpacing)) {
      throw new IllegalArgumentException("sample spacing must be positive: " + sampleSpacing);
    }
    int n = samples.length;
    if (n == 0) {
      return new Spectrum(List.of(), List.of());
    }
    double[] re = samples.clone();
    double[] im = new double[n];
    transform(re, im);

    int bins = n / 2 + 1;
    List<Double> frequencies = new ArrayList<>(bins);
    List<Double> amplitudes = new ArrayList<>(bins);
    for (int k = 0; k < bins; k++) {
      frequencies.add(k / (n * sampleSpacing));
      amplitudes.add(Math.hypot(re[k], im[k]));
    }
    return new Spectrum(frequencies, amplitudes);
  }

  // forward DFT in place: X_k = sum x_j e^(-2 pi i jk/n)
  static void transform(double[] re, double[] im) {
    int n = re.length;
    if (n != im.length) {
      throw new IllegalArgumentException("real and imaginary parts differ in length");
    }
    if (n <= 1) {
      return;
    }
    if (Integer.bitCount(n) == 1) {
      radix2(re, im);
    } else {
      bluestein(re, im);
    }
  }

  private static void radix2(double[] re, double[] im) {
    int n = re.length;
    for (int i = 1, j = 0; i < n; i++) {
      int bit = n >> 1;
      for (; (j & bit) != 0; bit >>= 1) {
        j ^= bit;
      }
      j ^= bit;
      if (i < j) {
        double t = re[i];
        re[i] = re[j];
        re[j] = t;
        t = im[i];
        im[i] = im[j];
        im[j] = t;
      }
    }
    for (int len = 2; len <= n; len <<= 1) {
      int half = len >> 1;
      double angle = -2 * Math.PI / len;
      for (int start = 0; start < n; start += len) {
        for (int k = 0; k < half; k++) {
          double wRe = Math.cos(angle * k);
          double wIm = Math.sin(angle * k);
          int a = start + k;
          int b = a + half;
          double tRe = re[b] * wRe - im[b] * wIm;
          double tIm = re[b] * wIm + im[b] * wRe;
          re[b] = re[a] - tRe;
          im[b] = im[a] - tIm;
          re[a] += tRe;
          im[a] += tIm;
        }
      }
    }
  }

  private static void inverseRadix2(double[] re, double[] im) {
    int n = re.length;
    for (int i = 0; i < n; i++) {
      im[i] = -im[i];
    }
    radix2(re, im);
    for (int i = 0; i < n; i++) {
      re[i] = re[i] / n;
      im[i] = -im[i] / n;
    }
  }

  private static void bluestein(double[] re, double[] im) {
    int n = re.length;
    int m = Integer.highestOneBit(2 * n - 1);
    if (m < 2 * n - 1) {
      m <<= 1;
    }

    // chirp w_k = e^{-i pi k^2 / n}; k^2 reduced mod 2n keeps the angle small
    double[] cosTable = new double[n];
    double[] sinTable = new double[n];
    for (int k = 0; k < n; k++) {
      long k2 = ((long) k * k) % (2L * n);
      double angle = Math.PI * k2 / n;
      cosTable[k] = Math.cos(angle);
      sinTable[k] = Math.sin(angle);
    }

    double[] aRe = new double[m];
    double[] aIm = new double[m];
    for (int k = 0; k < n; k++) {
      aRe[k] = re[k] * cosTable[k] + im[k] * sinTable[k];
      aIm[k] = -re[k] * sinTable[k] + im[k] * cosTable[k];
    }

    double[] bRe = new double[m];
    double[] bIm = new double[m];
    bRe[0] = cosTable[0];
    bIm[0] = sinTable[0];
    for (int k = 1; k < n; k++) {
      bRe[k] = bRe[m - k] = cosTable[k];
      bIm[k] = bIm[m - k] = sinTable[k];
    }

    radix2(aRe, aIm);
    radix2(bRe, bIm);
    for (int k = 0; k < m; k++) {
      double r = aRe[k] * bRe[k] - aIm[k] * bIm[k];
      double i = aRe[k] * bIm[k] + aIm[k] * bRe[k];
      aRe[k] = r;
      aIm[k] = i;
    }
    inverseRadix2(aRe, aIm);

    for (int k = 0; k < n; k++) {
      re[k] = aRe[k] * cosTable[k] + aIm[k] * sinTable[k];
      im[k] = -aRe[k] * sinTable[k] + aIm[k] * cosTable[k];
    }
  }
}
