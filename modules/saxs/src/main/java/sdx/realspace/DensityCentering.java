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

import sdx.saxs.DensityGrid;
import sdx.saxs.SupportMask;

import static org.apache.commons.math3.util.FastMath.round;

/**
 * Moves a density by whole voxels so its center of mass sits at the box center, voxel N/2.
 *
 * @since 1.0
 */
public final class DensityCentering {

  private DensityCentering() {
  }

  /**
   * The shift that brings the center of mass to the box center.
   *
   * @param density the density.
   * @return the shift along {x, y, z} in voxels.
   */
  public static int[] centeringShift(DensityGrid density) {
    double[] com = density.centerOfMass();
    int center = density.getN() / 2;
    return new int[] {
        (int) (center - round(com[0])),
        (int) (center - round(com[1])),
        (int) (center - round(com[2]))};
  }

  /**
   * Recenter a density in place and return the support moved by the same shift.
   *
   * @param density the density, modified.
   * @param support the support to move with it.
   * @return the shifted support.
   */
  public static SupportMask recenter(DensityGrid density, SupportMask support) {
    int[] shift = centeringShift(density);
    if (shift[0] == 0 && shift[1] == 0 && shift[2] == 0) {
      return support;
    }
    density.roll(shift);
    return support.roll(shift);
  }
}
