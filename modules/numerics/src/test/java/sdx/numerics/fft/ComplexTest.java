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
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collection;
import java.util.Random;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import sdx.utilities.SDXTest;

/**
 * Compares the mixed radix FFT against a direct DFT.
 */
@RunWith(Parameterized.class)
public class ComplexTest extends SDXTest {

  private final String info;
  private final int n;
  private final double[] data;
  private final double[] dft;
  private final double tolerance = 1.0e-10;

  public ComplexTest(String info, int n) {
    this.info = info;
    this.n = n;
    data = new double[2 * n];
    Random random = new Random(n);
    for (int i = 0; i < 2 * n; i++) {
      data[i] = random.nextDouble() - 0.5;
    }
    dft = new double[2 * n];
    for (int k = 0; k < n; k++) {
      double re = 0.0;
      double im = 0.0;
      for (int j = 0; j < n; j++) {
        double angle = -2.0 * PI * j * k / n;
        double c = cos(angle);
        double s = sin(angle);
        re += data[2 * j] * c - data[2 * j + 1] * s;
        im += data[2 * j] * s + data[2 * j + 1] * c;
      }
      dft[2 * k] = re;
      dft[2 * k + 1] = im;
    }
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Test n = 1", 1},
        {"Test n = 8", 8},
        {"Test n = 12", 12},
        {"Test n = 30", 30},
        {"Test n = 49", 49},
        {"Test n = 64", 64},
        {"Test n = 90", 90},
        {"Test n = 11", 11}
    });
  }

  @Test
  public void testFft() {
    double[] actual = Arrays.copyOf(data, data.length);
    Complex complex = new Complex(n);
    complex.fft(actual, 0, 2);
    for (int i = 0; i < 2 * n; i++) {
      assertEquals(info + " @ " + i, dft[i], actual[i], tolerance);
    }
  }

  @Test
  public void testInverse() {
    double[] actual = Arrays.copyOf(data, data.length);
    Complex complex = new Complex(n);
    complex.fft(actual, 0, 2);
    complex.inverse(actual, 0, 2);
    assertArrayEquals(info, data, actual, tolerance);
  }

  @Test
  public void testStridedData() {
    // Embed the sequence with a stride of 6 doubles and an offset of 3.
    int stride = 6;
    int offset = 3;
    double[] strided = new double[offset + stride * n + 2];
    for (int i = 0; i < n; i++) {
      strided[offset + stride * i] = data[2 * i];
      strided[offset + stride * i + 1] = data[2 * i + 1];
    }
    Complex complex = new Complex(n);
    complex.fft(strided, offset, stride);
    for (int i = 0; i < n; i++) {
      assertEquals(info, dft[2 * i], strided[offset + stride * i], tolerance);
      assertEquals(info, dft[2 * i + 1], strided[offset + stride * i + 1], tolerance);
    }
    assertEquals(0.0, strided[0], 0.0);
  }

  @Test
  public void testPreferredDimension() {
    int[] factors = new Complex(n).getFactors();
    int product = 1;
    boolean small = true;
    for (int factor : factors) {
      product *= factor;
      small &= factor <= 5;
    }
    assertEquals(info, n, product);
    assertEquals(info, n > 1 && small, Complex.preferredDimension(n));
  }
}
