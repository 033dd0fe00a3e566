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

import static java.lang.Double.isFinite;
import static java.lang.String.format;

import java.util.Arrays;

/**
 * An immutable one-dimensional scattering profile: momentum transfer q (inverse Angstrom), intensity
 * I(q) and its uncertainty sigma(q).
 *
 * <p>The q values are finite, non-negative and strictly increasing; sigma is finite and
 * non-negative; intensities are finite (they may be negative after background subtraction).
 *
 * @since 1.0
 */
public class ScatteringProfile {

  private final double[] q;
  private final double[] intensity;
  private final double[] sigma;

  /**
   * Constructor for ScatteringProfile. The arrays are copied.
   *
   * @param q         momentum transfer values.
   * @param intensity intensities.
   * @param sigma     intensity uncertainties.
   * @throws ConfigurationException if the arrays are inconsistent or violate the invariants.
   */
  public ScatteringProfile(double[] q, double[] intensity, double[] sigma) {
    if (q == null || intensity == null || sigma == null) {
      throw new ConfigurationException(" The q, intensity and sigma arrays are required.");
    }
    if (q.length != intensity.length || q.length != sigma.length) {
      throw new ConfigurationException(format(" Profile column lengths differ (q %d, I %d, sigma %d).",
          q.length, intensity.length, sigma.length));
    }
    for (int i = 0; i < q.length; i++) {
      if (!isFinite(q[i]) || q[i] < 0.0) {
        throw new ConfigurationException(format(" Invalid q value %s at point %d.", q[i], i));
      }
      if (i > 0 && q[i] <= q[i - 1]) {
        throw new ConfigurationException(
            format(" q values must be strictly increasing (point %d: %s <= %s).", i, q[i], q[i - 1]));
      }
      if (!isFinite(intensity[i])) {
        throw new ConfigurationException(format(" Invalid intensity %s at point %d.", intensity[i], i));
      }
      if (!isFinite(sigma[i]) || sigma[i] < 0.0) {
        throw new ConfigurationException(format(" Invalid sigma %s at point %d.", sigma[i], i));
      }
    }
    this.q = Arrays.copyOf(q, q.length);
    this.intensity = Arrays.copyOf(intensity, intensity.length);
    this.sigma = Arrays.copyOf(sigma, sigma.length);
  }

  /**
   * Build a profile from raw columns, dropping rows that contain NaN or a zero intensity or sigma,
   * and converting q to inverse Angstrom.
   *
   * @param q         raw momentum transfer values.
   * @param intensity raw intensities.
   * @param sigma     raw uncertainties.
   * @param units     the units of q.
   * @return the cleaned profile.
   */
  public static ScatteringProfile clean(double[] q, double[] intensity, double[] sigma,
                                        AngularUnits units) {
    int n = Math.min(q.length, Math.min(intensity.length, sigma.length));
    double[] cq = new double[n];
    double[] ci = new double[n];
    double[] cs = new double[n];
    int count = 0;
    for (int i = 0; i < n; i++) {
      if (Double.isNaN(q[i]) || Double.isNaN(intensity[i]) || Double.isNaN(sigma[i])) {
        continue;
      }
      if (intensity[i] == 0.0 || sigma[i] == 0.0) {
        continue;
      }
      cq[count] = units.toInverseAngstrom(q[i]);
      ci[count] = intensity[i];
      cs[count] = sigma[i];
      count++;
    }
    return new ScatteringProfile(Arrays.copyOf(cq, count), Arrays.copyOf(ci, count),
        Arrays.copyOf(cs, count));
  }

  public int size() {
    return q.length;
  }

  public boolean isEmpty() {
    return q.length == 0;
  }

  /**
   * True if every intensity is exactly zero (also true for an empty profile).
   *
   * @return true if no intensity is non-zero.
   */
  public boolean isAllZero() {
    for (double v : intensity) {
      if (v != 0.0) {
        return false;
      }
    }
    return true;
  }

  /**
   * True if every sigma is strictly positive, i.e. the profile supports chi-squared weighting.
   *
   * @return true if all sigma values are positive.
   */
  public boolean hasPositiveSigma() {
    if (sigma.length == 0) {
      return false;
    }
    for (double s : sigma) {
      if (s <= 0.0) {
        return false;
      }
    }
    return true;
  }

  public double getQ(int i) {
    return q[i];
  }

  public double getIntensity(int i) {
    return intensity[i];
  }

  public double getSigma(int i) {
    return sigma[i];
  }

  public double[] getQ() {
    return Arrays.copyOf(q, q.length);
  }

  public double[] getIntensity() {
    return Arrays.copyOf(intensity, intensity.length);
  }

  public double[] getSigma() {
    return Arrays.copyOf(sigma, sigma.length);
  }

  /**
   * Smallest q of the profile.
   *
   * @return q of the first point.
   */
  public double qMin() {
    return q[0];
  }

  /**
   * Largest q of the profile.
   *
   * @return q of the last point.
   */
  public double qMax() {
    return q[q.length - 1];
  }

  @Override
  public String toString() {
    if (isEmpty()) {
      return " Scattering profile: empty";
    }
    return format(" Scattering profile: %d points, q %8.5f to %8.5f (1/A)", size(), qMin(), qMax());
  }
}
