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

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.Arrays;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;

/**
 * Interpolates a measured profile onto a new q grid with not-a-knot cubic splines. Points outside
 * the measured range are extrapolated with the end polynomials, and the result is truncated at
 * the smaller of the two maximum q values.
 *
 * @since 1.0
 */
public class ProfileRegridder {

  /**
   * Number of points of the default grid linspace(0, qmax, n).
   */
  public static final int DEFAULT_POINTS = 501;

  private int firstPoint = 0;
  private int lastPoint = -1;

  /**
   * Restrict the input to the points first..last (inclusive, 0-based); -1 for last means the
   * final point.
   *
   * @param first the first point to use.
   * @param last  the last point to use.
   * @return this regridder.
   */
  public ProfileRegridder setRange(int first, int last) {
    if (first < 0 || (last >= 0 && last < first)) {
      throw new ConfigurationException(format(" Invalid point range %d to %d.", first, last));
    }
    this.firstPoint = first;
    this.lastPoint = last;
    return this;
  }

  /**
   * Regrid onto {@link #DEFAULT_POINTS} points from 0 to the largest measured q.
   *
   * @param profile the measured profile.
   * @return the regridded profile.
   */
  public ScatteringProfile regrid(ScatteringProfile profile) {
    ScatteringProfile usable = usable(profile);
    return interpolate(usable, linspace(usable.qMax(), DEFAULT_POINTS));
  }

  /**
   * Regrid onto n points from 0 to qMax.
   *
   * @param profile the measured profile.
   * @param qMax    the largest q of the new grid.
   * @param n       the number of points (at least 2).
   * @return the regridded profile.
   */
  public ScatteringProfile regrid(ScatteringProfile profile, double qMax, int n) {
    if (n < 2 || !(qMax > 0.0)) {
      throw new ConfigurationException(format(" Invalid q grid: %d points to %s.", n, qMax));
    }
    return interpolate(usable(profile), linspace(qMax, n));
  }

  /**
   * Regrid onto explicit q values, which must be non-negative and strictly increasing.
   *
   * @param profile the measured profile.
   * @param q       the new q values.
   * @return the regridded profile.
   */
  public ScatteringProfile regrid(ScatteringProfile profile, double[] q) {
    return interpolate(usable(profile), q);
  }

  /**
   * The selected point range without rows of zero intensity or sigma.
   */
  private ScatteringProfile usable(ScatteringProfile profile) {
    int last = (lastPoint < 0) ? profile.size() - 1 : Math.min(lastPoint, profile.size() - 1);
    int n = Math.max(0, last - firstPoint + 1);
    double[] q = new double[n];
    double[] intensity = new double[n];
    double[] sigma = new double[n];
    int count = 0;
    for (int i = firstPoint; i <= last; i++) {
      if (profile.getIntensity(i) != 0.0 && profile.getSigma(i) != 0.0) {
        q[count] = profile.getQ(i);
        intensity[count] = profile.getIntensity(i);
        sigma[count] = profile.getSigma(i);
        count++;
      }
    }
    if (count < 3) {
      throw new ConfigurationException(
          format(" Spline regridding needs at least 3 usable points (found %d).", count));
    }
    return new ScatteringProfile(Arrays.copyOf(q, count), Arrays.copyOf(intensity, count),
        Arrays.copyOf(sigma, count));
  }

  private static ScatteringProfile interpolate(ScatteringProfile profile, double[] qTarget) {
    double qMax = Math.min(profile.qMax(), qTarget[qTarget.length - 1]);
    int n = 0;
    while (n < qTarget.length && qTarget[n] <= qMax) {
      n++;
    }
    NotAKnotSplineInterpolator interpolator = new NotAKnotSplineInterpolator();
    double[] q = profile.getQ();
    PolynomialSplineFunction iFunction = interpolator.interpolate(q, profile.getIntensity());
    PolynomialSplineFunction sFunction = interpolator.interpolate(q, profile.getSigma());
    double[] qc = Arrays.copyOf(qTarget, n);
    double[] ic = new double[n];
    double[] sc = new double[n];
    for (int i = 0; i < n; i++) {
      ic[i] = evaluate(iFunction, qc[i]);
      // Extrapolated uncertainties can change sign.
      sc[i] = abs(evaluate(sFunction, qc[i]));
    }
    return new ScatteringProfile(qc, ic, sc);
  }

  /**
   * Evaluate a spline, extending its first and last pieces beyond the knots.
   */
  static double evaluate(PolynomialSplineFunction spline, double x) {
    double[] knots = spline.getKnots();
    PolynomialFunction[] polynomials = spline.getPolynomials();
    if (x < knots[0]) {
      return polynomials[0].value(x - knots[0]);
    }
    int last = polynomials.length - 1;
    if (x > knots[knots.length - 1]) {
      return polynomials[last].value(x - knots[last]);
    }
    return spline.value(x);
  }

  private static double[] linspace(double max, int n) {
    double[] q = new double[n];
    for (int i = 0; i < n; i++) {
      q[i] = max * i / (n - 1);
    }
    q[n - 1] = max;
    return q;
  }
}
