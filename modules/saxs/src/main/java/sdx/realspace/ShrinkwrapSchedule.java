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
package sdx.realspace;

import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The shrink-wrap schedule as a state machine. While EXPLORING, each accepted update narrows the
 * Gaussian width and raises the threshold fraction toward their final values; once both arrive
 * the schedule is REFINING. CONVERGED and DIVERGED are terminal until {@link #reset()}.
 *
 * @since 1.0
 */
public class ShrinkwrapSchedule {

  private static final Logger logger = Logger.getLogger(ShrinkwrapSchedule.class.getName());

  /**
   * Shrink-wrap states.
   */
  public enum State {
    EXPLORING, REFINING, CONVERGED, DIVERGED;

    public boolean isTerminal() {
      return this == CONVERGED || this == DIVERGED;
    }
  }

  private final int cadence;
  private final int minStep;
  private final double sigmaStart;
  private final double sigmaEnd;
  private final double sigmaDecay;
  private final double fractionStart;
  private final double fractionFinal;
  private final double fractionStep;
  private final int maxBadMasks;

  private State state;
  private double sigma;
  private double fraction;
  private int badMasks;
  private int updates;

  /**
   * Constructor for ShrinkwrapSchedule.
   *
   * @param cadence       iterations between updates.
   * @param minStep       first iteration of an update.
   * @param sigmaStart    initial Gaussian width in voxels.
   * @param sigmaEnd      final Gaussian width in voxels.
   * @param sigmaDecay    multiplicative width decay per accepted update.
   * @param fractionStart initial threshold fraction.
   * @param fractionFinal final threshold fraction.
   * @param fractionStep  fraction increase per accepted update.
   * @param maxBadMasks   consecutive bad masks that mean divergence.
   */
  public ShrinkwrapSchedule(int cadence, int minStep, double sigmaStart, double sigmaEnd,
                            double sigmaDecay, double fractionStart, double fractionFinal,
                            double fractionStep, int maxBadMasks) {
    this.cadence = cadence;
    this.minStep = minStep;
    this.sigmaStart = sigmaStart;
    this.sigmaEnd = sigmaEnd;
    this.sigmaDecay = sigmaDecay;
    this.fractionStart = fractionStart;
    this.fractionFinal = fractionFinal;
    this.fractionStep = fractionStep;
    this.maxBadMasks = maxBadMasks;
    reset();
  }

  /**
   * Return to EXPLORING with the initial width and fraction.
   */
  public final void reset() {
    state = State.EXPLORING;
    sigma = sigmaStart;
    fraction = fractionStart;
    badMasks = 0;
    updates = 0;
  }

  /**
   * True when a support update runs at this iteration.
   *
   * @param iteration the iteration, counted from 0 within the current attempt.
   * @return true on the update cadence from the first update step, unless terminal.
   */
  public boolean isUpdateDue(int iteration) {
    return !state.isTerminal() && iteration >= minStep && (iteration - minStep) % cadence == 0;
  }

  /**
   * Record an accepted mask: narrow the width, raise the fraction and move to REFINING once both
   * are final.
   *
   * @return the new state.
   */
  public State accepted() {
    if (state.isTerminal()) {
      return state;
    }
    badMasks = 0;
    updates++;
    sigma = Math.max(sigmaEnd, sigma * sigmaDecay);
    fraction = Math.min(fractionFinal, fraction + fractionStep);
    if (state == State.EXPLORING && sigma <= sigmaEnd && fraction >= fractionFinal) {
      transition(State.REFINING);
    }
    return state;
  }

  /**
   * Record a bad mask. The width and fraction are unchanged.
   *
   * @return the new state; DIVERGED after too many consecutive bad masks.
   */
  public State rejected() {
    if (state.isTerminal()) {
      return state;
    }
    badMasks++;
    if (badMasks >= maxBadMasks) {
      transition(State.DIVERGED);
    }
    return state;
  }

  /**
   * Mark the schedule converged.
   */
  public void converged() {
    if (!state.isTerminal()) {
      transition(State.CONVERGED);
    }
  }

  private void transition(State next) {
    logger.fine(format(" Shrink-wrap %s -> %s after %d updates (sigma %6.3f, fraction %5.3f)",
        state, next, updates, sigma, fraction));
    state = next;
  }

  public State getState() {
    return state;
  }

  public boolean isExploring() {
    return state == State.EXPLORING;
  }

  public boolean isRefining() {
    return state == State.REFINING;
  }

  /**
   * Gaussian width for the next update.
   *
   * @return sigma in voxels.
   */
  public double getSigma() {
    return sigma;
  }

  /**
   * Threshold fraction for the next update.
   *
   * @return the fraction.
   */
  public double getFraction() {
    return fraction;
  }

  public int getConsecutiveBadMasks() {
    return badMasks;
  }
}
