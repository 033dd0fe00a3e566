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
package sdx.saxs;

import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.util.MathArrays;

/**
 * Cubic spline interpolation with not-a-knot end conditions: the third derivative is continuous
 * across the second and the next-to-last knots. Unlike a natural spline, the end pieces keep their
 * curvature, so any cubic is reproduced exactly, including when the end pieces are extended past
 * the data. Three points give the interpolating parabola.
 *
 * @since 1.0
 */
class NotAKnotSplineInterpolator implements UnivariateInterpolator {

  @Override
  public PolynomialSplineFunction interpolate(double[] x, double[] y) {
    if (x.length != y.length) {
      throw new DimensionMismatchException(x.length, y.length);
    }
    int n = x.length;
    if (n < 3) {
      throw new NumberIsTooSmallException(LocalizedFormats.NUMBER_OF_POINTS, n, 3, true);
    }
    MathArrays.checkOrder(x);

    double[] h = new double[n - 1];
    double[] slope = new double[n - 1];
    for (int i = 0; i < n - 1; i++) {
      h[i] = x[i + 1] - x[i];
      slope[i] = (y[i + 1] - y[i]) / h[i];
    }

    // Second derivatives at the knots.
    double[] m = new double[n];
    if (n == 3) {
      double curvature = 2.0 * (slope[1] - slope[0]) / (h[0] + h[1]);
      m[0] = curvature;
      m[1] = curvature;
      m[2] = curvature;
    } else {
      solveInterior(h, slope, m);
      int last = n - 1;
      m[0] = ((h[0] + h[1]) * m[1] - h[0] * m[2]) / h[1];
      m[last] = ((h[last - 2] + h[last - 1]) * m[last - 1] - h[last - 1] * m[last - 2]) / h[last - 2];
    }

    PolynomialFunction[] polynomials = new PolynomialFunction[n - 1];
    for (int i = 0; i < n - 1; i++) {
      double b = slope[i] - h[i] * (2.0 * m[i] + m[i + 1]) / 6.0;
      double c = 0.5 * m[i];
      double d = (m[i + 1] - m[i]) / (6.0 * h[i]);
      polynomials[i] = new PolynomialFunction(new double[] {y[i], b, c, d});
    }
    return new PolynomialSplineFunction(x, polynomials);
  }

  /**
   * Solve the tridiagonal system for the interior second derivatives m[1..n-2]. The end
   * conditions are folded into the first and last rows.
   */
  private static void solveInterior(double[] h, double[] slope, double[] m) {
    int k = h.length - 1;
    double[] lower = new double[k];
    double[] diagonal = new double[k];
    double[] upper = new double[k];
    double[] rhs = new double[k];
    for (int r = 0; r < k; r++) {
      int i = r + 1;
      lower[r] = h[i - 1];
      diagonal[r] = 2.0 * (h[i - 1] + h[i]);
      upper[r] = h[i];
      rhs[r] = 6.0 * (slope[i] - slope[i - 1]);
    }
    double h0 = h[0];
    double h1 = h[1];
    diagonal[0] = (h0 + h1) * (h0 + 2.0 * h1) / h1;
    upper[0] = (h1 * h1 - h0 * h0) / h1;
    double a = h[k - 1];
    double b = h[k];
    lower[k - 1] = (a * a - b * b) / a;
    diagonal[k - 1] = (a + b) * (2.0 * a + b) / a;

    // Thomas algorithm.
    for (int r = 1; r < k; r++) {
      double w = lower[r] / diagonal[r - 1];
      diagonal[r] -= w * upper[r - 1];
      rhs[r] -= w * rhs[r - 1];
    }
    m[k] = rhs[k - 1] / diagonal[k - 1];
    for (int r = k - 2; r >= 0; r--) {
      m[r + 1] = (rhs[r] - upper[r] * m[r + 2]) / diagonal[r];
    }
  }
}
