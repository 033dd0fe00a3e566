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

import java.util.logging.Level;
import java.util.logging.Logger;

import sdx.saxs.DensityGrid;
import sdx.saxs.GridSpace;
import sdx.saxs.SupportMask;

import static java.lang.String.format;

/**
 * Shrink-wrap support estimation. The density is smoothed with a Gaussian, thresholded at a
 * fraction of the smoothed maximum (ties included) and intersected with a global bounding mask
 * and, for a monotonic support, with the previous mask. Optionally only the connected region with
 * the most density is kept.
 *
 * <p>A new mask that is empty, or that covers the whole bounding region, is reported as bad and
 * is not applied by the caller.
 *
 * @since 1.0
 */
public class SupportEstimator {

  private static final Logger logger = Logger.getLogger(SupportEstimator.class.getName());

  /**
   * Outcome of one support update.
   */
  public enum Status {
    /** The new mask is usable. */
    ACCEPTED,
    /** The new mask holds no voxels. */
    EMPTY,
    /** The new mask fills the bounding region. */
    FULL;

    public boolean isBad() {
      return this != ACCEPTED;
    }
  }

  /**
   * Result of one support update.
   *
   * @param mask      the new mask (also returned for bad masks, for diagnosis).
   * @param status    whether the mask is usable.
   * @param threshold the absolute smoothed density threshold.
   */
  public record SupportUpdate(SupportMask mask, Status status, double threshold) {

    public boolean isAccepted() {
      return status == Status.ACCEPTED;
    }
  }

  private final GridSpace gridSpace;
  private final SupportMask bounding;
  private final int boundingCount;
  private final DensitySmoother smoother;
  private final boolean monotonic;

  /**
   * Constructor for SupportEstimator.
   *
   * @param bounding  the global bounding region; masks never grow beyond it.
   * @param smoother  the Gaussian smoother for this grid.
   * @param monotonic intersect each new mask with the previous one.
   */
  public SupportEstimator(SupportMask bounding, DensitySmoother smoother, boolean monotonic) {
    this.gridSpace = bounding.getGridSpace();
    this.bounding = bounding;
    this.boundingCount = bounding.count();
    this.smoother = smoother;
    this.monotonic = monotonic;
  }

  public SupportMask getBounding() {
    return bounding;
  }

  /**
   * Threshold smoothed values at a fraction of their maximum. Ties are included.
   *
   * @param smoothed the smoothed density.
   * @param fraction the threshold fraction in [0, 1].
   * @return the flags of voxels at or above the threshold.
   */
  public static boolean[] threshold(double[] smoothed, double fraction) {
    double max = Double.NEGATIVE_INFINITY;
    for (double v : smoothed) {
      max = Math.max(max, v);
    }
    double threshold = fraction * max;
    boolean[] mask = new boolean[smoothed.length];
    if (!(max > 0.0)) {
      return mask;
    }
    for (int i = 0; i < smoothed.length; i++) {
      mask[i] = smoothed[i] >= threshold;
    }
    return mask;
  }

  /**
   * Estimate a new support.
   *
   * @param density      the current density.
   * @param previous     the current support.
   * @param sigma        the Gaussian width in voxels.
   * @param fraction     the threshold fraction.
   * @param connectivity keep only the connected region with the most density.
   * @return the update.
   */
  public SupportUpdate estimate(DensityGrid density, SupportMask previous, double sigma,
                                double fraction, boolean connectivity) {
    double[] smoothed = smoother.smooth(density, sigma);
    double max = Double.NEGATIVE_INFINITY;
    for (double v : smoothed) {
      max = Math.max(max, v);
    }
    boolean[] flags = threshold(smoothed, fraction);
    for (int i = 0; i < flags.length; i++) {
      flags[i] = flags[i] && bounding.get(i) && (!monotonic || previous.get(i));
    }
    if (connectivity) {
      flags = ConnectivityFilter.largestRegion(flags, density.getValues(), gridSpace.getN());
    }
    SupportMask mask = SupportMask.of(gridSpace, flags);
    int count = mask.count();
    Status status;
    if (count == 0) {
      status = Status.EMPTY;
    } else if (count >= boundingCount) {
      status = Status.FULL;
    } else {
      status = Status.ACCEPTED;
    }
    double threshold = fraction * max;
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Support update: sigma %6.3f, fraction %5.3f, threshold %10.4e, %d voxels (%s)",
          sigma, fraction, threshold, count, status));
    }
    return new SupportUpdate(mask, status, threshold);
  }
}
