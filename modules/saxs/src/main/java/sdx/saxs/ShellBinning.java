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
import static org.apache.commons.math3.util.FastMath.floor;

/**
 * Assignment of reciprocal grid voxels to spherical shells of constant |q|. Membership depends only
 * on the grid geometry.
 *
 * <p>The shell width is dq - 1e-8 so that every axis frequency starts a new shell. The voxels
 * beyond the last full shell (the corners of the reciprocal cube) are gathered into the
 * outermost shell.
 *
 * @since 1.0
 */
public class ShellBinning {

  /**
   * Shell width offset that keeps axis frequencies from sitting on a shell edge.
   */
  static final double SHELL_EPSILON = 1.0e-8;

  private final GridSpace gridSpace;
  private final int[] shellIndex;
  private final int[] counts;
  private final double[] centers;
  private final double shellWidth;

  /**
   * Constructor for ShellBinning.
   *
   * @param gridSpace the grid geometry.
   */
  public ShellBinning(GridSpace gridSpace) {
    this.gridSpace = gridSpace;
    int n = gridSpace.getN();
    shellWidth = gridSpace.getDq() - SHELL_EPSILON;

    double qMax = 0.0;
    double[] qMagnitude = new double[gridSpace.size()];
    int index = 0;
    for (int k = 0; k < n; k++) {
      for (int j = 0; j < n; j++) {
        for (int i = 0; i < n; i++) {
          double q = gridSpace.qMagnitude(i, j, k);
          qMagnitude[index++] = q;
          if (q > qMax) {
            qMax = q;
          }
        }
      }
    }

    int lastShell = (int) floor(qMax / shellWidth);
    int nShells = lastShell + 1;
    shellIndex = new int[qMagnitude.length];
    counts = new int[nShells];
    centers = new double[nShells];
    for (int i = 0; i < qMagnitude.length; i++) {
      int shell = Math.min((int) floor(qMagnitude[i] / shellWidth), lastShell);
      shellIndex[i] = shell;
      counts[shell]++;
      centers[shell] += qMagnitude[i];
    }
    for (int s = 0; s < nShells; s++) {
      if (counts[s] > 0) {
        centers[s] /= counts[s];
      } else {
        centers[s] = (s + 0.5) * shellWidth;
      }
    }
  }

  public GridSpace getGridSpace() {
    return gridSpace;
  }

  public int getNumberOfShells() {
    return counts.length;
  }

  public double getShellWidth() {
    return shellWidth;
  }

  /**
   * Shell of a voxel.
   *
   * @param index the voxel index.
   * @return the shell.
   */
  public int shellOf(int index) {
    return shellIndex[index];
  }

  /**
   * Number of voxels in a shell.
   *
   * @param shell the shell.
   * @return the voxel count.
   */
  public int count(int shell) {
    return counts[shell];
  }

  /**
   * Mean |q| of the voxels in a shell.
   *
   * @param shell the shell.
   * @return q in inverse Angstrom.
   */
  public double center(int shell) {
    return centers[shell];
  }

  public double[] getCenters() {
    return centers.clone();
  }

  @Override
  public String toString() {
    return format(" Shells: %d of width %8.5f 1/A, outermost center %8.5f 1/A",
        counts.length, shellWidth, centers[counts.length - 1]);
  }
}
