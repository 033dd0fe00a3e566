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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import sdx.utilities.SDXTest;

/**
 * Tests spline regridding of measured profiles.
 */
public class ProfileRegridderTest extends SDXTest {

  /**
   * I(q) = 10 - 20 q and sigma(q) = 1 + q, with a zero intensity row.
   */
  private static ScatteringProfile linearProfile() {
    double[] q = {0.02, 0.05, 0.1, 0.15, 0.2, 0.25, 0.3};
    double[] intensity = new double[q.length];
    double[] sigma = new double[q.length];
    for (int i = 0; i < q.length; i++) {
      intensity[i] = 10.0 - 20.0 * q[i];
      sigma[i] = 1.0 + q[i];
    }
    intensity[3] = 0.0;
    return new ScatteringProfile(q, intensity, sigma);
  }

  @Test
  public void testDefaultGrid() {
    ScatteringProfile regridded = new ProfileRegridder().regrid(linearProfile());
    assertEquals(ProfileRegridder.DEFAULT_POINTS, regridded.size());
    assertEquals(0.0, regridded.qMin(), 0.0);
    assertEquals(0.3, regridded.qMax(), 1.0e-12);
    // Linear data is reproduced, and the end pieces extrapolate it.
    for (int i = 0; i < regridded.size(); i++) {
      double q = regridded.getQ(i);
      assertEquals(10.0 - 20.0 * q, regridded.getIntensity(i), 1.0e-9);
      assertEquals(1.0 + q, regridded.getSigma(i), 1.0e-9);
    }
  }

  private static double cubic(double q) {
    return 5.0 + q - 4.0 * q * q + 2.0 * q * q * q;
  }

  @Test
  public void testCubicReproducedWithEndCurvature() {
    double[] q = {0.03, 0.045, 0.07, 0.11, 0.16, 0.2, 0.29, 0.35, 0.42, 0.5};
    double[] intensity = new double[q.length];
    double[] sigma = new double[q.length];
    for (int i = 0; i < q.length; i++) {
      intensity[i] = cubic(q[i]);
      sigma[i] = 1.0 + q[i] * q[i];
    }
    ScatteringProfile regridded =
        new ProfileRegridder().regrid(new ScatteringProfile(q, intensity, sigma));
    assertEquals(0.5, regridded.qMax(), 1.0e-12);
    // The points below q = 0.03 are extrapolated with the first piece.
    assertEquals(5.0, regridded.getIntensity(0), 1.0e-9);
    for (int i = 0; i < regridded.size(); i++) {
      double qi = regridded.getQ(i);
      assertEquals(cubic(qi), regridded.getIntensity(i), 1.0e-9);
      assertEquals(1.0 + qi * qi, regridded.getSigma(i), 1.0e-9);
    }
  }

  @Test
  public void testThreePointsGiveParabola() {
    double[] q = {0.1, 0.2, 0.4};
    double[] intensity = {3.0 - q[0] * q[0], 3.0 - q[1] * q[1], 3.0 - q[2] * q[2]};
    double[] sigma = {1.0, 1.0, 1.0};
    ScatteringProfile regridded = new ProfileRegridder()
        .regrid(new ScatteringProfile(q, intensity, sigma), new double[] {0.0, 0.3});
    assertEquals(3.0, regridded.getIntensity(0), 1.0e-12);
    assertEquals(3.0 - 0.09, regridded.getIntensity(1), 1.0e-12);
  }

  @Test
  public void testTruncatedAtCommonMaximum() {
    ScatteringProfile regridded = new ProfileRegridder().regrid(linearProfile(), 0.5, 51);
    assertTrue(regridded.qMax() <= 0.3);
    assertEquals(31, regridded.size());
  }

  @Test
  public void testExplicitGridAndRange() {
    double[] q = {0.06, 0.12, 0.18};
    ScatteringProfile regridded = new ProfileRegridder().setRange(1, 5).regrid(linearProfile(), q);
    assertEquals(3, regridded.size());
    assertEquals(10.0 - 20.0 * 0.12, regridded.getIntensity(1), 1.0e-9);
  }

  @Test(expected = ConfigurationException.class)
  public void testTooFewPoints() {
    new ProfileRegridder().setRange(2, 3).regrid(linearProfile());
  }
}
