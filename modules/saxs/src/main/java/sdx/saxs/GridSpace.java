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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.sqrt;

import sdx.numerics.fft.Complex;

/**
 * The GridSpace class describes the cubic real space grid of a reconstruction and its paired
 * reciprocal space sampling. Instances are immutable.
 *
 * <p>Real space coordinates are x_i = (i - N/2) * voxelSize, so the box center is voxel N/2.
 * Reciprocal space components follow the discrete Fourier ordering q_i = dq * f(i), with f(i) = i
 * for i &lt; (N+1)/2 and i - N otherwise, and dq = 2 pi / side.
 *
 * @since 1.0
 */
public class GridSpace {

  /**
   * The smallest usable grid side length.
   */
  public static final int MIN_GRID_SIZE = 8;

  private final int n;
  private final double side;
  private final double voxelSize;
  private final double maxDimension;
  private final double oversampling;
  private final double dq;

  private GridSpace(int n, double side, double maxDimension, double oversampling) {
    this.n = n;
    this.side = side;
    this.voxelSize = side / n;
    this.maxDimension = maxDimension;
    this.oversampling = oversampling;
    this.dq = 2.0 * PI / side;
  }

  /**
   * Build the grid for a particle of maximum dimension Dmax. The box side is oversampling * Dmax,
   * the number of samples is raised to the next even FFT friendly length and the voxel size is
   * then side / N.
   *
   * @param maxDimension the particle maximum dimension (Angstrom).
   * @param voxelSize    the requested voxel size (Angstrom).
   * @param oversampling the ratio of the box side to Dmax.
   * @param maxGridSize  the largest permitted N.
   * @return the grid.
   * @throws ConfigurationException for non-positive inputs or a degenerate grid.
   */
  public static GridSpace create(double maxDimension, double voxelSize, double oversampling,
                                 int maxGridSize) {
    if (!(maxDimension > 0.0) || Double.isInfinite(maxDimension)) {
      throw new ConfigurationException(format(" The maximum dimension must be positive: %s", maxDimension));
    }
    if (!(voxelSize > 0.0) || Double.isInfinite(voxelSize)) {
      throw new ConfigurationException(format(" The voxel size must be positive: %s", voxelSize));
    }
    if (!(oversampling > 1.0) || Double.isInfinite(oversampling)) {
      throw new ConfigurationException(format(" The oversampling ratio must exceed 1: %s", oversampling));
    }
    double side = oversampling * maxDimension;
    double samples = floor(side / voxelSize);
    if (samples < MIN_GRID_SIZE) {
      throw new ConfigurationException(format(
          " A box of %8.3f A sampled at %8.3f A gives only %d voxels per side (minimum %d).",
          side, voxelSize, (int) samples, MIN_GRID_SIZE));
    }
    if (samples > maxGridSize) {
      throw new ConfigurationException(format(
          " A box of %8.3f A sampled at %8.3f A needs %d voxels per side (maximum %d).",
          side, voxelSize, (long) samples, maxGridSize));
    }
    int n = nextGridSize((int) samples);
    if (n > maxGridSize) {
      throw new ConfigurationException(format(
          " The FFT friendly grid size %d exceeds the maximum %d.", n, maxGridSize));
    }
    return new GridSpace(n, side, maxDimension, oversampling);
  }

  /**
   * Build the grid that matches an existing density: N samples of the given voxel size.
   *
   * @param n         samples per side.
   * @param voxelSize the voxel size (Angstrom).
   * @return the grid.
   * @throws ConfigurationException if n is too small or the voxel size is not positive.
   */
  public static GridSpace forDensity(int n, double voxelSize) {
    if (n < MIN_GRID_SIZE) {
      throw new ConfigurationException(format(" Grid size %d is below the minimum %d.", n, MIN_GRID_SIZE));
    }
    if (!(voxelSize > 0.0) || Double.isInfinite(voxelSize)) {
      throw new ConfigurationException(format(" The voxel size must be positive: %s", voxelSize));
    }
    double side = n * voxelSize;
    return new GridSpace(n, side, side, 1.0);
  }

  /**
   * The smallest even length at or above n whose prime factors are all 2, 3 or 5.
   *
   * @param n a lower bound.
   * @return the grid size.
   */
  static int nextGridSize(int n) {
    int size = (n % 2 == 0) ? n : n + 1;
    while (!Complex.preferredDimension(size)) {
      size += 2;
    }
    return size;
  }

  public int getN() {
    return n;
  }

  /**
   * Total number of voxels, N^3.
   *
   * @return the voxel count.
   */
  public int size() {
    return n * n * n;
  }

  public double getSide() {
    return side;
  }

  public double getVoxelSize() {
    return voxelSize;
  }

  public double getVoxelVolume() {
    return voxelSize * voxelSize * voxelSize;
  }

  public double getMaxDimension() {
    return maxDimension;
  }

  public double getOversampling() {
    return oversampling;
  }

  /**
   * The reciprocal space sampling interval dq = 2 pi / side.
   *
   * @return dq in inverse Angstrom.
   */
  public double getDq() {
    return dq;
  }

  /**
   * Real space coordinate of the lower corner of the box.
   *
   * @return the origin in Angstrom.
   */
  public double getOrigin() {
    return -(n / 2) * voxelSize;
  }

  /**
   * Real space coordinate of voxel i along any axis.
   *
   * @param i the voxel index.
   * @return the coordinate in Angstrom.
   */
  public double coordinate(int i) {
    return (i - n / 2) * voxelSize;
  }

  /**
   * Signed discrete frequency index of sample i.
   *
   * @param i the sample index.
   * @return i for i &lt; (N+1)/2 and i - N otherwise.
   */
  public int frequency(int i) {
    return (i < (n + 1) / 2) ? i : i - n;
  }

  /**
   * Reciprocal space component of sample i.
   *
   * @param i the sample index.
   * @return q in inverse Angstrom.
   */
  public double qComponent(int i) {
    return dq * frequency(i);
  }

  /**
   * Magnitude of the scattering vector at reciprocal grid point (i, j, k).
   *
   * @param i x index.
   * @param j y index.
   * @param k z index.
   * @return |q| in inverse Angstrom.
   */
  public double qMagnitude(int i, int j, int k) {
    double qx = qComponent(i);
    double qy = qComponent(j);
    double qz = qComponent(k);
    return sqrt(qx * qx + qy * qy + qz * qz);
  }

  /**
   * The largest positive axis frequency.
   *
   * @return q in inverse Angstrom.
   */
  public double maxAxisQ() {
    return dq * ((n + 1) / 2 - 1);
  }

  /**
   * Linear index of voxel (i, j, k), X fastest.
   *
   * @param i x index.
   * @param j y index.
   * @param k z index.
   * @return the linear index.
   */
  public int index(int i, int j, int k) {
    return i + n * (j + n * k);
  }

  @Override
  public String toString() {
    return format(" Grid: N = %d, side = %8.3f A, voxel = %6.3f A, dq = %8.5f 1/A, Dmax = %8.3f A",
        n, side, voxelSize, dq, maxDimension);
  }
}
