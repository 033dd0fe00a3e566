// ******************************************************************************
//
// Title:       Solution Density X.
// Description: Solution Density X - Density from Solution Scattering.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of Solution Density X.
//
// Solution Density X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Solution Density X is distributed in the hope that it will be useful, but
// WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
// FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Solution Density X; if not, write to the Free Software Foundation, Inc., 59
// Temple Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package sdx.numerics.fft;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Compute the FFT of complex, double precision data of arbitrary length n. This class uses a
 * self-sorting (Stockham) mixed radix method with special passes for factors 2 and 4 and a general
 * pass for all other factors.
 *
 * <p>The data points are read from and written to the locations
 *
 * <PRE>
 * Re(d[i]) = data[offset + stride*i]
 * Im(d[i]) = data[offset + stride*i + 1]
 * </PRE>
 *
 * The forward transform uses the kernel exp(-2 pi i jk / n). Neither direction is normalized, so
 * an fft followed by an ifft scales the data by n; {@link #inverse(double[], int, int)} applies the
 * 1/n factor.
 *
 * @see <ul>
 * <li><a href="http://dx.doi.org/10.1016/0021-9991(83)90013-X" target="_blank"> Clive
 * Temperton. Self-sorting mixed-radix fast fourier transforms. Journal of Computational
 * Physics, 52(1):1-23, 1983. </a>
 * <li><a href="http://www.jstor.org/stable/2003354" target="_blank"> J. W. Cooley and J. W.
 * Tukey, Mathematics of Computation 19 (90), 297 (1965) </a>
 * </ul>
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Complex {

  /**
   * Factors with a cheap butterfly; lengths built only from these are preferred.
   */
  private static final int[] availableFactors = {4, 2, 3, 5};
  /**
   * Number of complex numbers in the transform.
   */
  private final int n;
  /**
   * Factorization of n.
   */
  private final int[] factors;
  /**
   * Cosine of the twiddle angles for each pass.
   */
  private final double[][] twiddleCos;
  /**
   * Sine of the twiddle angles for each pass.
   */
  private final double[][] twiddleSin;
  /**
   * Cosine of the roots of unity for each pass.
   */
  private final double[][] rootCos;
  /**
   * Sine of the roots of unity for each pass.
   */
  private final double[][] rootSin;
  /**
   * Packing of non-contiguous data.
   */
  private final double[] packedData;
  /**
   * Scratch space for the transform.
   */
  private final double[] scratch;

  /**
   * Construct a Complex instance for data of length n. Scratch memory of length 4*n is reused each
   * time a transform is computed, so an instance must not be shared between threads.
   *
   * @param n Number of complex numbers (n .GT. 0).
   */
  public Complex(int n) {
    if (n < 1) {
      throw new IllegalArgumentException(" The FFT length must be positive: " + n);
    }
    this.n = n;
    factors = factor(n);
    int nPass = factors.length;
    twiddleCos = new double[nPass][];
    twiddleSin = new double[nPass][];
    rootCos = new double[nPass][];
    rootSin = new double[nPass][];
    int len = n;
    for (int pass = 0; pass < nPass; pass++) {
      int factor = factors[pass];
      // The twiddle for output digit k1 and position j is exp(i 2 pi j k1 / len), j*k1 < len.
      double theta = 2.0 * PI / len;
      twiddleCos[pass] = new double[len];
      twiddleSin[pass] = new double[len];
      for (int t = 0; t < len; t++) {
        twiddleCos[pass][t] = cos(theta * t);
        twiddleSin[pass][t] = sin(theta * t);
      }
      double phi = 2.0 * PI / factor;
      rootCos[pass] = new double[factor];
      rootSin[pass] = new double[factor];
      for (int r = 0; r < factor; r++) {
        rootCos[pass][r] = cos(phi * r);
        rootSin[pass][r] = sin(phi * r);
      }
      len /= factor;
    }
    packedData = new double[2 * n];
    scratch = new double[2 * n];
  }

  /**
   * Check if a dimension is a preferred dimension.
   *
   * @param dim the dimension to check.
   * @return true if the dimension is a preferred dimension.
   */
  public static boolean preferredDimension(int dim) {
    if (dim < 2) {
      return false;
    }
    for (int factor : availableFactors) {
      while ((dim % factor) == 0) {
        dim /= factor;
      }
    }
    return dim <= 1;
  }

  /**
   * Factor n into the available factors first, followed by any remaining primes in increasing
   * order.
   *
   * @param n the length to factor.
   * @return the factors; an empty array for n = 1.
   */
  static int[] factor(int n) {
    List<Integer> list = new ArrayList<>();
    int remaining = n;
    for (int factor : availableFactors) {
      while (remaining % factor == 0) {
        list.add(factor);
        remaining /= factor;
      }
    }
    for (int p = 7; remaining > 1; p += 2) {
      while (remaining % p == 0) {
        list.add(p);
        remaining /= p;
      }
    }
    return list.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * Getter for the field <code>factors</code>.
   *
   * @return an array of int.
   */
  public int[] getFactors() {
    return Arrays.copyOf(factors, factors.length);
  }

  /**
   * Getter for the transform length.
   *
   * @return the number of complex points.
   */
  public int getN() {
    return n;
  }

  /**
   * Compute the forward Fast Fourier Transform of data leaving the result in data.
   *
   * @param data   an array of double.
   * @param offset the offset to the beginning of the data.
   * @param stride the stride between data points.
   */
  public void fft(double[] data, int offset, int stride) {
    transformInternal(data, offset, stride, -1);
  }

  /**
   * Compute the (un-normalized) inverse FFT of data, leaving the result in data.
   *
   * @param data   an array of double.
   * @param offset the offset to the beginning of the data.
   * @param stride the stride between data points.
   */
  public void ifft(double[] data, int offset, int stride) {
    transformInternal(data, offset, stride, +1);
  }

  /**
   * Compute the normalized inverse FFT of data, leaving the result in data.
   *
   * @param data   an array of double.
   * @param offset the offset to the beginning of the data.
   * @param stride the stride between data points.
   */
  public void inverse(double[] data, int offset, int stride) {
    ifft(data, offset, stride);
    double norm = 1.0 / n;
    for (int i = 0; i < n; i++) {
      int index = offset + stride * i;
      data[index] *= norm;
      data[index + 1] *= norm;
    }
  }

  private void transformInternal(double[] data, int offset, int stride, int sign) {
    for (int i = 0, index = offset; i < n; i++, index += stride) {
      packedData[2 * i] = data[index];
      packedData[2 * i + 1] = data[index + 1];
    }

    double[] in = packedData;
    double[] out = scratch;
    int s = 1;
    int len = n;
    for (int pass = 0; pass < factors.length; pass++) {
      int factor = factors[pass];
      int m = len / factor;
      switch (factor) {
        case 2 -> pass2(in, out, s, m, pass, sign);
        case 4 -> pass4(in, out, s, m, pass, sign);
        default -> passGeneral(in, out, factor, s, m, pass, sign);
      }
      double[] swap = in;
      in = out;
      out = swap;
      s *= factor;
      len = m;
    }

    for (int i = 0, index = offset; i < n; i++, index += stride) {
      data[index] = in[2 * i];
      data[index + 1] = in[2 * i + 1];
    }
  }

  /**
   * Radix 2 pass. Element j + r*m of sub-sequence q is read from q + s*(j + r*m), and output digit
   * k1 of position j is written to q + s*(2*j + k1).
   */
  private void pass2(double[] in, double[] out, int s, int m, int pass, int sign) {
    double[] wCos = twiddleCos[pass];
    double[] wSin = twiddleSin[pass];
    for (int j = 0; j < m; j++) {
      double wr = wCos[j];
      double wi = sign * wSin[j];
      for (int q = 0; q < s; q++) {
        int i0 = 2 * (q + s * j);
        int i1 = 2 * (q + s * (j + m));
        double ar = in[i0];
        double ai = in[i0 + 1];
        double br = in[i1];
        double bi = in[i1 + 1];
        int o0 = 2 * (q + s * 2 * j);
        int o1 = o0 + 2 * s;
        out[o0] = ar + br;
        out[o0 + 1] = ai + bi;
        double dr = ar - br;
        double di = ai - bi;
        out[o1] = dr * wr - di * wi;
        out[o1 + 1] = dr * wi + di * wr;
      }
    }
  }

  /**
   * Radix 4 pass, using exp(sign * i * pi / 2) = sign * i.
   */
  private void pass4(double[] in, double[] out, int s, int m, int pass, int sign) {
    double[] wCos = twiddleCos[pass];
    double[] wSin = twiddleSin[pass];
    for (int j = 0; j < m; j++) {
      double w1r = wCos[j];
      double w1i = sign * wSin[j];
      double w2r = wCos[2 * j];
      double w2i = sign * wSin[2 * j];
      double w3r = wCos[3 * j];
      double w3i = sign * wSin[3 * j];
      for (int q = 0; q < s; q++) {
        int i0 = 2 * (q + s * j);
        int i1 = 2 * (q + s * (j + m));
        int i2 = 2 * (q + s * (j + 2 * m));
        int i3 = 2 * (q + s * (j + 3 * m));
        double sr02 = in[i0] + in[i2];
        double si02 = in[i0 + 1] + in[i2 + 1];
        double dr02 = in[i0] - in[i2];
        double di02 = in[i0 + 1] - in[i2 + 1];
        double sr13 = in[i1] + in[i3];
        double si13 = in[i1 + 1] + in[i3 + 1];
        double dr13 = in[i1] - in[i3];
        double di13 = in[i1 + 1] - in[i3 + 1];

        double b0r = sr02 + sr13;
        double b0i = si02 + si13;
        double b1r = dr02 - sign * di13;
        double b1i = di02 + sign * dr13;
        double b2r = sr02 - sr13;
        double b2i = si02 - si13;
        double b3r = dr02 + sign * di13;
        double b3i = di02 - sign * dr13;

        int o0 = 2 * (q + s * 4 * j);
        int o1 = o0 + 2 * s;
        int o2 = o1 + 2 * s;
        int o3 = o2 + 2 * s;
        out[o0] = b0r;
        out[o0 + 1] = b0i;
        out[o1] = b1r * w1r - b1i * w1i;
        out[o1 + 1] = b1r * w1i + b1i * w1r;
        out[o2] = b2r * w2r - b2i * w2i;
        out[o2 + 1] = b2r * w2i + b2i * w2r;
        out[o3] = b3r * w3r - b3i * w3i;
        out[o3 + 1] = b3r * w3i + b3i * w3r;
      }
    }
  }

  /**
   * General pass for any factor: a direct DFT of length factor followed by the twiddle.
   */
  private void passGeneral(double[] in, double[] out, int factor, int s, int m, int pass,
                           int sign) {
    double[] wCos = twiddleCos[pass];
    double[] wSin = twiddleSin[pass];
    double[] rCos = rootCos[pass];
    double[] rSin = rootSin[pass];
    for (int j = 0; j < m; j++) {
      for (int q = 0; q < s; q++) {
        for (int k1 = 0; k1 < factor; k1++) {
          double sumR = 0.0;
          double sumI = 0.0;
          for (int r = 0; r < factor; r++) {
            int i = 2 * (q + s * (j + r * m));
            int rk = (r * k1) % factor;
            double c = rCos[rk];
            double sn = sign * rSin[rk];
            sumR += in[i] * c - in[i + 1] * sn;
            sumI += in[i] * sn + in[i + 1] * c;
          }
          int t = j * k1;
          double wr = wCos[t];
          double wi = sign * wSin[t];
          int o = 2 * (q + s * (factor * j + k1));
          out[o] = sumR * wr - sumI * wi;
          out[o + 1] = sumR * wi + sumI * wr;
        }
      }
    }
  }

  /**
   * String representation of the Complex FFT.
   *
   * @return a String.
   */
  @Override
  public String toString() {
    return " Complex FFT: n = " + n + "\n  Factors: " + Arrays.toString(factors);
  }
}
