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

import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * A cubic real space electron density on a {@link GridSpace}. Values are stored X fastest, see
 * {@link GridSpace#index(int, int, int)}.
 *
 * <p>A DensityGrid is owned by one reconstruction and mutated in place between iteration
 * boundaries; use {@link #copy()} to take a snapshot.
 *
 * @since 1.0
 */
public class DensityGrid {

  private final GridSpace gridSpace;
  private final double[] values;

  /**
   * Constructor for an all zero DensityGrid.
   *
   * @param gridSpace the grid geometry.
   */
  public DensityGrid(GridSpace gridSpace) {
    this.gridSpace = gridSpace;
    this.values = new double[gridSpace.size()];
  }

  /**
   * Constructor for DensityGrid. The values are copied.
   *
   * @param gridSpace the grid geometry.
   * @param values    N^3 density values, X fastest.
   */
  public DensityGrid(GridSpace gridSpace, double[] values) {
    if (values.length != gridSpace.size()) {
      throw new IllegalArgumentException(String.format(
          " Density length %d does not match the grid (%d).", values.length, gridSpace.size()));
    }
    this.gridSpace = gridSpace;
    this.values = Arrays.copyOf(values, values.length);
  }

  public GridSpace getGridSpace() {
    return gridSpace;
  }

  public int getN() {
    return gridSpace.getN();
  }

  public double getVoxelSize() {
    return gridSpace.getVoxelSize();
  }

  public double getOrigin() {
    return gridSpace.getOrigin();
  }

  public int size() {
    return values.length;
  }

  /**
   * The backing array, X fastest. Changes write through.
   *
   * @return the density values.
   */
  public double[] getValues() {
    return values;
  }

  /**
   * A copy of the density values.
   *
   * @return a new array.
   */
  public double[] toArray() {
    return Arrays.copyOf(values, values.length);
  }

  public double get(int index) {
    return values[index];
  }

  public double get(int i, int j, int k) {
    return values[gridSpace.index(i, j, k)];
  }

  public void set(int index, double value) {
    values[index] = value;
  }

  public void set(int i, int j, int k, double value) {
    values[gridSpace.index(i, j, k)] = value;
  }

  public double sum() {
    double sum = 0.0;
    for (double v : values) {
      sum += v;
    }
    return sum;
  }

  /**
   * Multiply every voxel by a factor.
   *
   * @param factor the scale factor.
   */
  public void scale(double factor) {
    for (int i = 0; i < values.length; i++) {
      values[i] *= factor;
    }
  }

  public boolean isNonNegative() {
    for (double v : values) {
      if (v < 0.0) {
        return false;
      }
    }
    return true;
  }

  public boolean isFinite() {
    for (double v : values) {
      if (!Double.isFinite(v)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Density weighted center in voxel units. Returns the box center for a grid with no density.
   *
   * @return the fractional voxel coordinates {i, j, k}.
   */
  public double[] centerOfMass() {
    int n = gridSpace.getN();
    double total = 0.0;
    double ci = 0.0;
    double cj = 0.0;
    double ck = 0.0;
    int index = 0;
    for (int k = 0; k < n; k++) {
      for (int j = 0; j < n; j++) {
        for (int i = 0; i < n; i++) {
          double v = values[index++];
          total += v;
          ci += v * i;
          cj += v * j;
          ck += v * k;
        }
      }
    }
    if (total == 0.0) {
      double c = n / 2;
      return new double[] {c, c, c};
    }
    return new double[] {ci / total, cj / total, ck / total};
  }

  /**
   * Radius of gyration of the density about its center of mass, in Angstrom. Zero for a grid
   * with no density.
   *
   * @return Rg in Angstrom.
   */
  public double radiusOfGyration() {
    double total = sum();
    if (total == 0.0) {
      return 0.0;
    }
    double[] com = centerOfMass();
    int n = gridSpace.getN();
    double sum = 0.0;
    int index = 0;
    for (int k = 0; k < n; k++) {
      double dk = k - com[2];
      for (int j = 0; j < n; j++) {
        double dj = j - com[1];
        for (int i = 0; i < n; i++) {
          double di = i - com[0];
          sum += values[index++] * (di * di + dj * dj + dk * dk);
        }
      }
    }
    double rg2 = sum / total;
    if (rg2 <= 0.0) {
      return 0.0;
    }
    return sqrt(rg2) * gridSpace.getVoxelSize();
  }

  /**
   * Periodic shift of the density by whole voxels.
   *
   * @param shift the shift along {x, y, z}.
   */
  public void roll(int[] shift) {
    roll(values, gridSpace.getN(), shift);
  }

  /**
   * Periodic shift of an N^3 array by whole voxels, in place.
   *
   * @param data  the array (X fastest).
   * @param n     samples per side.
   * @param shift the shift along {x, y, z}.
   */
  static void roll(double[] data, int n, int[] shift) {
    int sx = Math.floorMod(shift[0], n);
    int sy = Math.floorMod(shift[1], n);
    int sz = Math.floorMod(shift[2], n);
    if (sx == 0 && sy == 0 && sz == 0) {
      return;
    }
    double[] copy = Arrays.copyOf(data, data.length);
    int index = 0;
    for (int k = 0; k < n; k++) {
      int kk = (k + sz) % n;
      for (int j = 0; j < n; j++) {
        int jj = (j + sy) % n;
        for (int i = 0; i < n; i++) {
          int ii = (i + sx) % n;
          data[ii + n * (jj + n * kk)] = copy[index++];
        }
      }
    }
  }

  /**
   * An independent copy of this density.
   *
   * @return the copy.
   */
  public DensityGrid copy() {
    return new DensityGrid(gridSpace, values);
  }
}
