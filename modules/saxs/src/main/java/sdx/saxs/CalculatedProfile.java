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
 * The radially averaged intensity of a {@link ReciprocalGrid}: one value per shell of a
 * {@link ShellBinning}. Shells with no contributing voxels are invalid.
 *
 * @since 1.0
 */
public class CalculatedProfile {

  private final double[] q;
  private final double[] intensity;
  private final boolean[] valid;

  /**
   * Constructor for CalculatedProfile. The arrays are copied.
   *
   * @param q         shell centers.
   * @param intensity mean |F|^2 per shell.
   * @param valid     true for shells with at least one voxel.
   */
  public CalculatedProfile(double[] q, double[] intensity, boolean[] valid) {
    if (q.length != intensity.length || q.length != valid.length) {
      throw new IllegalArgumentException(" Calculated profile arrays differ in length.");
    }
    this.q = Arrays.copyOf(q, q.length);
    this.intensity = Arrays.copyOf(intensity, intensity.length);
    this.valid = Arrays.copyOf(valid, valid.length);
  }

  public int size() {
    return q.length;
  }

  public double getQ(int shell) {
    return q[shell];
  }

  public double getIntensity(int shell) {
    return intensity[shell];
  }

  public boolean isValid(int shell) {
    return valid[shell];
  }

  public double[] getQ() {
    return Arrays.copyOf(q, q.length);
  }

  public double[] getIntensity() {
    return Arrays.copyOf(intensity, intensity.length);
  }
}
