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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import sdx.realspace.ShrinkwrapSchedule;

/**
 * The state of one reconstruction attempt: the iteration counters, the current density and
 * support, the residual history and the best snapshot seen so far.
 *
 * <p>An IterationState is created by {@link ReconstructionLoop} for each attempt and updated at
 * every iteration; listeners may read it but must not keep references to its grids.
 *
 * @since 1.0
 */
public class IterationState {

  private final int attempt;
  private final long seed;
  private final ConvergenceTracker tracker;
  private final ShrinkwrapSchedule schedule;
  private final List<NumericalInstabilityWarning> warnings;
  private DensityGrid density;
  private SupportMask support;
  private int iteration;
  private int totalIterations;
  private double scale = Double.NaN;
  private int consecutiveWarnings;
  private boolean converged;
  private DensityGrid bestDensity;
  private SupportMask bestSupport;
  private double bestResidual = Double.POSITIVE_INFINITY;

  IterationState(int attempt, long seed, DensityGrid density, SupportMask support,
                 ConvergenceTracker tracker, ShrinkwrapSchedule schedule,
                 List<NumericalInstabilityWarning> warnings, int totalIterations) {
    this.attempt = attempt;
    this.seed = seed;
    this.density = density;
    this.support = support;
    this.tracker = tracker;
    this.schedule = schedule;
    this.warnings = warnings;
    this.totalIterations = totalIterations;
    this.bestDensity = density.copy();
    this.bestSupport = support;
  }

  /**
   * Restart count of this attempt, 0 for the first.
   *
   * @return the attempt.
   */
  public int getAttempt() {
    return attempt;
  }

  public long getSeed() {
    return seed;
  }

  /**
   * Iterations completed in this attempt.
   *
   * @return the iteration count.
   */
  public int getIteration() {
    return iteration;
  }

  /**
   * Iterations completed over all attempts.
   *
   * @return the iteration count.
   */
  public int getTotalIterations() {
    return totalIterations;
  }

  public DensityGrid getDensity() {
    return density;
  }

  public SupportMask getSupport() {
    return support;
  }

  public double getScale() {
    return scale;
  }

  public double getResidual() {
    return tracker.getLast();
  }

  public double[] getResidualHistory() {
    return tracker.getHistory();
  }

  public ShrinkwrapSchedule.State getSupportState() {
    return schedule.getState();
  }

  public boolean isConverged() {
    return converged;
  }

  public double getBestResidual() {
    return bestResidual;
  }

  public DensityGrid getBestDensity() {
    return bestDensity;
  }

  public SupportMask getBestSupport() {
    return bestSupport;
  }

  /**
   * Warnings from every attempt of the run so far.
   *
   * @return an unmodifiable view.
   */
  public List<NumericalInstabilityWarning> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  ConvergenceTracker getTracker() {
    return tracker;
  }

  ShrinkwrapSchedule getSchedule() {
    return schedule;
  }

  void setDensity(DensityGrid density) {
    this.density = density;
  }

  void setSupport(SupportMask support) {
    this.support = support;
  }

  void setScale(double scale) {
    this.scale = scale;
  }

  /**
   * Record the residual of the density that entered this iteration, keeping a snapshot when it is
   * the best so far.
   */
  void recordResidual(double residual) {
    boolean armed = schedule.isRefining();
    if (tracker.update(residual, armed)) {
      bestResidual = residual;
      bestDensity = density.copy();
      bestSupport = support;
    }
  }

  /**
   * Record the warnings of one iteration.
   *
   * @return the number of consecutive iterations with a warning.
   */
  int recordWarnings(List<NumericalInstabilityWarning> iterationWarnings) {
    if (iterationWarnings.isEmpty()) {
      consecutiveWarnings = 0;
    } else {
      warnings.addAll(iterationWarnings);
      consecutiveWarnings++;
    }
    return consecutiveWarnings;
  }

  void completeIteration() {
    iteration++;
    totalIterations++;
  }

  void setConverged(boolean converged) {
    this.converged = converged;
  }

  @Override
  public String toString() {
    return String.format(" Attempt %d, iteration %6d: residual %12.6e (best %12.6e), support %s",
        attempt, iteration, getResidual(), bestResidual, schedule.getState());
  }
}
