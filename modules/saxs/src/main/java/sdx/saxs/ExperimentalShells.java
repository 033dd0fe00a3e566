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

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The measured intensity and uncertainty interpolated onto the shell centers of a
 * {@link ShellBinning}. Shells outside [q_first, q_last] of the profile carry no data.
 *
 * @since 1.0
 */
public class ExperimentalShells {

  private static final Logger logger = Logger.getLogger(ExperimentalShells.class.getName());

  private final double[] intensity;
  private final double[] sigma;
  private final boolean[] covered;
  private final int coveredCount;
  private final boolean weighted;

  /**
   * Constructor for ExperimentalShells.
   *
   * @param profile            the measured profile (at least two points).
   * @param binning            the shell layout of the grid.
   * @param chiSquareWeighting request 1 / sigma^2 weights; ignored unless every sigma is positive.
   * @throws ConfigurationException if the profile is too short or misses every shell.
   */
  public ExperimentalShells(ScatteringProfile profile, ShellBinning binning,
                            boolean chiSquareWeighting) {
    if (profile.size() < 2) {
      throw new ConfigurationException(
          format(" At least two profile points are required (found %d).", profile.size()));
    }
    int nShells = binning.getNumberOfShells();
    intensity = new double[nShells];
    sigma = new double[nShells];
    covered = new boolean[nShells];

    LinearInterpolator interpolator = new LinearInterpolator();
    double[] q = profile.getQ();
    PolynomialSplineFunction iFunction = interpolator.interpolate(q, profile.getIntensity());
    PolynomialSplineFunction sFunction = interpolator.interpolate(q, profile.getSigma());
    double qFirst = profile.qMin();
    double qLast = profile.qMax();
    int count = 0;
    for (int s = 0; s < nShells; s++) {
      double center = binning.center(s);
      if (binning.count(s) > 0 && center >= qFirst && center <= qLast) {
        intensity[s] = iFunction.value(center);
        sigma[s] = sFunction.value(center);
        covered[s] = true;
        count++;
      }
    }
    if (count == 0) {
      throw new ConfigurationException(format(
          " The profile (q %8.5f to %8.5f 1/A) does not overlap the grid shells (width %8.5f 1/A).",
          qFirst, qLast, binning.getShellWidth()));
    }
    coveredCount = count;

    boolean positiveSigma = profile.hasPositiveSigma();
    if (chiSquareWeighting && !positiveSigma) {
      logger.info(" Some sigma values are not positive; the residual is not weighted.");
    }
    weighted = chiSquareWeighting && positiveSigma;
  }

  public int getNumberOfShells() {
    return covered.length;
  }

  /**
   * Number of shells with experimental data.
   *
   * @return the count.
   */
  public int getCoveredCount() {
    return coveredCount;
  }

  public boolean isCovered(int shell) {
    return covered[shell];
  }

  public double getIntensity(int shell) {
    return intensity[shell];
  }

  public double getSigma(int shell) {
    return sigma[shell];
  }

  public boolean isWeighted() {
    return weighted;
  }

  /**
   * Residual weight of a shell: 1 / sigma^2 when weighted, otherwise 1.
   *
   * @param shell the shell.
   * @return the weight.
   */
  public double weight(int shell) {
    if (!weighted) {
      return 1.0;
    }
    return 1.0 / (sigma[shell] * sigma[shell]);
  }
}
