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
 * A boolean mask with the shape of a {@link DensityGrid}: true marks voxels where density is
 * permitted.
 *
 * @since 1.0
 */
public class SupportMask {

  private final GridSpace gridSpace;
  private final boolean[] mask;

  private SupportMask(GridSpace gridSpace, boolean[] mask) {
    this.gridSpace = gridSpace;
    this.mask = mask;
  }

  /**
   * Constructor for SupportMask. The array is copied.
   *
   * @param gridSpace the grid geometry.
   * @param mask      N^3 flags, X fastest.
   * @return the mask.
   */
  public static SupportMask of(GridSpace gridSpace, boolean[] mask) {
    if (mask.length != gridSpace.size()) {
      throw new IllegalArgumentException(String.format(
          " Mask length %d does not match the grid (%d).", mask.length, gridSpace.size()));
    }
    return new SupportMask(gridSpace, Arrays.copyOf(mask, mask.length));
  }

  /**
   * A mask covering the whole grid.
   *
   * @param gridSpace the grid geometry.
   * @return the mask.
   */
  public static SupportMask full(GridSpace gridSpace) {
    boolean[] mask = new boolean[gridSpace.size()];
    Arrays.fill(mask, true);
    return new SupportMask(gridSpace, mask);
  }

  /**
   * A mask covering no voxels.
   *
   * @param gridSpace the grid geometry.
   * @return the mask.
   */
  public static SupportMask empty(GridSpace gridSpace) {
    return new SupportMask(gridSpace, new boolean[gridSpace.size()]);
  }

  /**
   * A sphere about the box center. Voxels whose real space coordinate lies within the radius are
   * included.
   *
   * @param gridSpace the grid geometry.
   * @param radius    the radius in Angstrom.
   * @return the mask.
   */
  public static SupportMask sphere(GridSpace gridSpace, double radius) {
    int n = gridSpace.getN();
    boolean[] mask = new boolean[gridSpace.size()];
    double r2 = radius * radius;
    int index = 0;
    for (int k = 0; k < n; k++) {
      double z = gridSpace.coordinate(k);
      for (int j = 0; j < n; j++) {
        double y = gridSpace.coordinate(j);
        for (int i = 0; i < n; i++) {
          double x = gridSpace.coordinate(i);
          mask[index++] = x * x + y * y + z * z <= r2;
        }
      }
    }
    return new SupportMask(gridSpace, mask);
  }

  public GridSpace getGridSpace() {
    return gridSpace;
  }

  public int size() {
    return mask.length;
  }

  public boolean get(int index) {
    return mask[index];
  }

  public boolean get(int i, int j, int k) {
    return mask[gridSpace.index(i, j, k)];
  }

  /**
   * A copy of the flags.
   *
   * @return a new array.
   */
  public boolean[] toArray() {
    return Arrays.copyOf(mask, mask.length);
  }

  /**
   * Number of voxels in the support.
   *
   * @return the count.
   */
  public int count() {
    int count = 0;
    for (boolean b : mask) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  public boolean isEmpty() {
    return count() == 0;
  }

  /**
   * Enclosed volume in cubic Angstrom.
   *
   * @return count times the voxel volume.
   */
  public double volume() {
    return count() * gridSpace.getVoxelVolume();
  }

  /**
   * True when every voxel of this mask is also in the other.
   *
   * @param other another mask of the same shape.
   * @return true if this mask is a subset of other.
   */
  public boolean isSubsetOf(SupportMask other) {
    for (int i = 0; i < mask.length; i++) {
      if (mask[i] && !other.mask[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Periodic shift by whole voxels.
   *
   * @param shift the shift along {x, y, z}.
   * @return a new mask.
   */
  public SupportMask roll(int[] shift) {
    int n = gridSpace.getN();
    int sx = Math.floorMod(shift[0], n);
    int sy = Math.floorMod(shift[1], n);
    int sz = Math.floorMod(shift[2], n);
    boolean[] result = new boolean[mask.length];
    int index = 0;
    for (int k = 0; k < n; k++) {
      int kk = (k + sz) % n;
      for (int j = 0; j < n; j++) {
        int jj = (j + sy) % n;
        for (int i = 0; i < n; i++) {
          int ii = (i + sx) % n;
          result[ii + n * (jj + n * kk)] = mask[index++];
        }
      }
    }
    return new SupportMask(gridSpace, result);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(mask, ((SupportMask) o).mask);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(mask);
  }
}
