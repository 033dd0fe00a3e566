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

import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The reciprocal space projection: voxel magnitudes are corrected so the radially averaged
 * intensity of each shell matches the measured intensity, on the current scale, with phases kept.
 * Shells without data pass through unchanged.
 *
 * @since 1.0
 */
public class ReciprocalConstraint {

  private final ExperimentalShells experimental;
  private final ShellBinning binning;
  private final ScaleMethod scaleMethod;
  private final AmplitudeMode amplitudeMode;

  /**
   * Constructor for ReciprocalConstraint.
   *
   * @param experimental  the measured intensities per shell.
   * @param binning       the shell layout.
   * @param scaleMethod   how the scale factor is fit.
   * @param amplitudeMode how magnitudes are corrected.
   */
  public ReciprocalConstraint(ExperimentalShells experimental, ShellBinning binning,
                              ScaleMethod scaleMethod, AmplitudeMode amplitudeMode) {
    this.experimental = experimental;
    this.binning = binning;
    this.scaleMethod = scaleMethod;
    this.amplitudeMode = amplitudeMode;
  }

  public ExperimentalShells getExperimental() {
    return experimental;
  }

  /**
   * A shell takes part in scaling, the residual and the projection when it has experimental data
   * and calculated voxels.
   */
  private boolean usable(CalculatedProfile calculated, int shell) {
    return experimental.isCovered(shell) && calculated.isValid(shell);
  }

  /**
   * The scale factor s that puts s I_calc on the scale of I_exp.
   *
   * @param calculated the calculated profile.
   * @return the scale, which may be zero, negative or NaN for a degenerate profile.
   */
  public double scaleFactor(CalculatedProfile calculated) {
    switch (scaleMethod) {
      case FIRST_SHELL:
        for (int s = 0; s < calculated.size(); s++) {
          if (usable(calculated, s)) {
            return experimental.getIntensity(s) / calculated.getIntensity(s);
          }
        }
        return Double.NaN;
      case LEAST_SQUARES:
      default:
        double num = 0.0;
        double den = 0.0;
        for (int s = 0; s < calculated.size(); s++) {
          if (usable(calculated, s)) {
            double w = experimental.weight(s);
            double ic = calculated.getIntensity(s);
            num += w * ic * experimental.getIntensity(s);
            den += w * ic * ic;
          }
        }
        return num / den;
    }
  }

  /**
   * True for a scale that can be used by the projection.
   *
   * @param scale a scale factor.
   * @return true if finite and positive.
   */
  public static boolean isValidScale(double scale) {
    return Double.isFinite(scale) && scale > 0.0;
  }

  /**
   * Goodness of fit between the scaled calculated intensities and the measured ones. An invalid
   * scale is treated as zero.
   *
   * <p>Weighted: sum w (s I_calc - I_exp)^2 / n. Unweighted: sum (s I_calc - I_exp)^2 / sum
   * I_exp^2.
   *
   * @param calculated the calculated profile.
   * @param scale      the scale factor.
   * @return the residual.
   */
  public double residual(CalculatedProfile calculated, double scale) {
    double s = isValidScale(scale) ? scale : 0.0;
    double sum = 0.0;
    double norm = 0.0;
    int n = 0;
    for (int shell = 0; shell < calculated.size(); shell++) {
      if (usable(calculated, shell)) {
        double ie = experimental.getIntensity(shell);
        double d = s * calculated.getIntensity(shell) - ie;
        sum += experimental.weight(shell) * d * d;
        norm += ie * ie;
        n++;
      }
    }
    if (n == 0) {
      return Double.POSITIVE_INFINITY;
    }
    if (experimental.isWeighted()) {
      return sum / n;
    }
    if (norm == 0.0) {
      return sum;
    }
    return sum / norm;
  }

  /**
   * Correct the voxel magnitudes in place. Phases are unchanged; shells without data and a
   * calculated intensity of zero are left alone under RESCALE.
   *
   * @param reciprocal the reciprocal grid, modified.
   * @param calculated its radial profile.
   * @param scale      a valid scale factor.
   * @return the same reciprocal grid.
   * @throws IllegalArgumentException for an invalid scale.
   */
  public ReciprocalGrid apply(ReciprocalGrid reciprocal, CalculatedProfile calculated,
                              double scale) {
    if (!isValidScale(scale)) {
      throw new IllegalArgumentException(" Invalid scale factor: " + scale);
    }
    int nShells = calculated.size();
    double[] factor = new double[nShells];
    boolean[] correct = new boolean[nShells];
    for (int s = 0; s < nShells; s++) {
      if (!usable(calculated, s)) {
        continue;
      }
      double ie = Math.max(experimental.getIntensity(s), 0.0);
      if (amplitudeMode == AmplitudeMode.REPLACE) {
        factor[s] = sqrt(ie / scale);
        correct[s] = true;
      } else {
        double ic = calculated.getIntensity(s);
        if (ic > 0.0) {
          factor[s] = sqrt(ie / (scale * ic));
          correct[s] = true;
        }
      }
    }

    int size = reciprocal.getGridSpace().size();
    for (int i = 0; i < size; i++) {
      int s = binning.shellOf(i);
      if (!correct[s]) {
        continue;
      }
      if (amplitudeMode == AmplitudeMode.RESCALE) {
        reciprocal.scale(i, factor[s]);
      } else {
        double re = reciprocal.real(i);
        double im = reciprocal.imaginary(i);
        double magnitude = sqrt(re * re + im * im);
        if (magnitude > 0.0) {
          double ratio = factor[s] / magnitude;
          reciprocal.set(i, re * ratio, im * ratio);
        } else {
          reciprocal.set(i, factor[s], 0.0);
        }
      }
    }
    return reciprocal;
  }
}
