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
import sdx.saxs.GridSpace;
import sdx.saxs.SupportMask;

/**
 * The real space projection: density outside the support is set to zero and negative density is
 * clamped to zero. With a flat solvent boundary, density outside that looser sphere is zeroed as
 * well.
 *
 * @since 1.0
 */
public class RealSpaceConstraint {

  private final SupportMask solventBoundary;

  /**
   * Constructor for a RealSpaceConstraint without a flat solvent boundary.
   */
  public RealSpaceConstraint() {
    this(null);
  }

  /**
   * Constructor for RealSpaceConstraint.
   *
   * @param solventBoundary density outside this mask is zeroed on every call; may be null.
   */
  public RealSpaceConstraint(SupportMask solventBoundary) {
    this.solventBoundary = solventBoundary;
  }

  /**
   * A constraint whose solvent boundary is a sphere about the box center.
   *
   * @param gridSpace the grid geometry.
   * @param radius    the solvent boundary radius in Angstrom.
   * @return the constraint.
   */
  public static RealSpaceConstraint withFlatSolvent(GridSpace gridSpace, double radius) {
    return new RealSpaceConstraint(SupportMask.sphere(gridSpace, radius));
  }

  public boolean isFlatSolvent() {
    return solventBoundary != null;
  }

  /**
   * Apply the projection in place.
   *
   * @param density the density, modified.
   * @param support the current support.
   * @return the same density, element-wise non-negative.
   */
  public DensityGrid apply(DensityGrid density, SupportMask support) {
    double[] values = density.getValues();
    if (support.size() != values.length) {
      throw new IllegalArgumentException(" The support and the density differ in shape.");
    }
    for (int i = 0; i < values.length; i++) {
      double v = values[i];
      // NaN fails the comparison and is zeroed with the negatives.
      if (!support.get(i) || !(v > 0.0)) {
        values[i] = 0.0;
      } else if (solventBoundary != null && !solventBoundary.get(i)) {
        values[i] = 0.0;
      }
    }
    return density;
  }
}
