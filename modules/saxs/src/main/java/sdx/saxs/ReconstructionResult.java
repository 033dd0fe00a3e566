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

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The immutable outcome of a reconstruction: the final density and support, the residual history
 * of the final attempt and the reason the run stopped.
 *
 * <p>For {@link TerminationReason#CANCELLED} the density and support are the snapshot with the
 * lowest residual seen before cancellation. The final residual, scale and calculated profile
 * always describe the returned density.
 *
 * @since 1.0
 */
public class ReconstructionResult {

  private final DensityGrid density;
  private final SupportMask support;
  private final double[] residualHistory;
  private final TerminationReason terminationReason;
  private final double finalResidual;
  private final double scaleFactor;
  private final CalculatedProfile calculatedProfile;
  private final int iterations;
  private final int restarts;
  private final long seed;
  private final List<NumericalInstabilityWarning> warnings;
  private final double elapsedSeconds;

  ReconstructionResult(DensityGrid density, SupportMask support, double[] residualHistory,
                       TerminationReason terminationReason, double finalResidual,
                       double scaleFactor, CalculatedProfile calculatedProfile, int iterations,
                       int restarts, long seed, List<NumericalInstabilityWarning> warnings,
                       double elapsedSeconds) {
    this.density = density.copy();
    this.support = support;
    this.residualHistory = Arrays.copyOf(residualHistory, residualHistory.length);
    this.terminationReason = terminationReason;
    this.finalResidual = finalResidual;
    this.scaleFactor = scaleFactor;
    this.calculatedProfile = calculatedProfile;
    this.iterations = iterations;
    this.restarts = restarts;
    this.seed = seed;
    this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    this.elapsedSeconds = elapsedSeconds;
  }

  /**
   * The final density. A copy is returned.
   *
   * @return the density.
   */
  public DensityGrid getDensity() {
    return density.copy();
  }

  public SupportMask getSupport() {
    return support;
  }

  /**
   * Residual of every iteration of the final attempt. Earlier attempts that ended in a restart
   * are not included, so after a restart the history is shorter than {@link #getIterations()}.
   *
   * @return a copy of the history.
   */
  public double[] getResidualHistory() {
    return Arrays.copyOf(residualHistory, residualHistory.length);
  }

  public TerminationReason getTerminationReason() {
    return terminationReason;
  }

  public boolean isConverged() {
    return terminationReason.isConverged();
  }

  /**
   * Residual of the returned density against the measured profile.
   *
   * @return the residual.
   */
  public double getFinalResidual() {
    return finalResidual;
  }

  /**
   * Lowest residual in the history of the final attempt.
   *
   * @return the best residual, or +infinity for an empty history.
   */
  public double getBestResidual() {
    double best = Double.POSITIVE_INFINITY;
    for (double r : residualHistory) {
      if (r < best) {
        best = r;
      }
    }
    return best;
  }

  public double getScaleFactor() {
    return scaleFactor;
  }

  public CalculatedProfile getCalculatedProfile() {
    return calculatedProfile;
  }

  public double getRadiusOfGyration() {
    return density.radiusOfGyration();
  }

  public double getSupportVolume() {
    return support.volume();
  }

  public GridSpace getGridSpace() {
    return density.getGridSpace();
  }

  /**
   * Iterations over all attempts.
   *
   * @return the iteration count.
   */
  public int getIterations() {
    return iterations;
  }

  public int getRestarts() {
    return restarts;
  }

  /**
   * Seed of the first attempt; restarts derive theirs from it.
   *
   * @return the seed.
   */
  public long getSeed() {
    return seed;
  }

  public List<NumericalInstabilityWarning> getWarnings() {
    return warnings;
  }

  public double getElapsedSeconds() {
    return elapsedSeconds;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.MULTI_LINE_STYLE)
        .append("terminationReason", terminationReason)
        .append("iterations", iterations)
        .append("restarts", restarts)
        .append("finalResidual", finalResidual)
        .append("scaleFactor", scaleFactor)
        .append("radiusOfGyration", getRadiusOfGyration())
        .append("supportVolume", getSupportVolume())
        .append("gridSize", density.getN())
        .append("voxelSize", density.getVoxelSize())
        .append("seed", seed)
        .append("warnings", warnings.size())
        .toString();
  }
}
