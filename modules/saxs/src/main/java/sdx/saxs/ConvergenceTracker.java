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

import java.util.Arrays;

/**
 * Keeps the residual history of one reconstruction attempt and decides when to stop.
 *
 * <p>Conditions are checked in order: the iteration budget, a plateau of the best residual over
 * the trailing window, and the absolute threshold. Plateau detection is armed only after the
 * caller has reported {@code window} armed iterations, so the tracker cannot report a plateau
 * while the support is still being explored.
 *
 * @since 1.0
 */
public class ConvergenceTracker {

  private final int maxIterations;
  private final int window;
  private final double tolerance;
  private final double threshold;

  private double[] history = new double[64];
  private int size;
  private int armedCount;
  private double best = Double.POSITIVE_INFINITY;
  private int bestIteration = -1;

  /**
   * Constructor for ConvergenceTracker.
   *
   * @param maxIterations iteration budget.
   * @param window        trailing window for plateau detection.
   * @param tolerance     relative improvement below which a plateau is declared.
   * @param threshold     absolute residual threshold; zero or less disables it.
   */
  public ConvergenceTracker(int maxIterations, int window, double tolerance, double threshold) {
    this.maxIterations = maxIterations;
    this.window = window;
    this.tolerance = tolerance;
    this.threshold = threshold;
  }

  /**
   * Append a residual.
   *
   * @param residual the residual of the latest iteration.
   * @param armed    true while plateau detection may count this iteration.
   * @return true if this residual is the best so far.
   */
  public boolean update(double residual, boolean armed) {
    if (size == history.length) {
      history = Arrays.copyOf(history, 2 * size);
    }
    history[size] = residual;
    if (armed) {
      armedCount++;
    }
    boolean improved = residual < best;
    if (improved) {
      best = residual;
      bestIteration = size;
    }
    size++;
    return improved;
  }

  /**
   * Check the stopping rules.
   *
   * @param iterations iterations used so far, including those of earlier attempts.
   * @return the reason to stop, or null to continue.
   */
  public TerminationReason check(int iterations) {
    if (iterations >= maxIterations) {
      return TerminationReason.MAX_ITERATIONS;
    }
    if (isPlateau()) {
      return TerminationReason.PLATEAU;
    }
    if (threshold > 0.0 && size > 0 && history[size - 1] < threshold) {
      return TerminationReason.THRESHOLD;
    }
    return null;
  }

  /**
   * True when, with at least {@code window} armed iterations, the best residual of the trailing
   * window improves on the best residual before it by less than the relative tolerance.
   *
   * @return true for a plateau.
   */
  public boolean isPlateau() {
    if (armedCount < window || size <= window) {
      return false;
    }
    double bestBefore = min(0, size - window);
    double bestWindow = min(size - window, size);
    if (bestBefore <= 0.0) {
      return true;
    }
    return (bestBefore - bestWindow) / bestBefore < tolerance;
  }

  private double min(int from, int to) {
    double min = Double.POSITIVE_INFINITY;
    for (int i = from; i < to; i++) {
      // NaN residuals never count as improvements.
      if (history[i] < min) {
        min = history[i];
      }
    }
    return min;
  }

  public int size() {
    return size;
  }

  public double getBest() {
    return best;
  }

  /**
   * Index in the history of the best residual, or -1 before the first update.
   *
   * @return the iteration of the best residual.
   */
  public int getBestIteration() {
    return bestIteration;
  }

  public double getLast() {
    return size == 0 ? Double.NaN : history[size - 1];
  }

  /**
   * A copy of the residual history.
   *
   * @return one residual per iteration.
   */
  public double[] getHistory() {
    return Arrays.copyOf(history, size);
  }
}
