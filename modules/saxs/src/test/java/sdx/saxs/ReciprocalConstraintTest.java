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

import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;
import sdx.utilities.SDXTest;

/**
 * Tests scaling, the residual and the amplitude projection.
 */
public class ReciprocalConstraintTest extends SDXTest {

  private static final int FIRST_SHELL = 2;
  private static final int LAST_SHELL = 6;

  private GridSpace gridSpace;
  private FourierBridge bridge;
  private ReciprocalGrid reciprocal;
  private CalculatedProfile calculated;

  @Before
  public void setUp() {
    gridSpace = GridSpace.forDensity(16, 2.0);
    bridge = new FourierBridge(gridSpace);
    Random random = new Random(42);
    DensityGrid density = new DensityGrid(gridSpace);
    double[] values = density.getValues();
    for (int i = 0; i < values.length; i++) {
      values[i] = random.nextDouble();
    }
    reciprocal = bridge.forward(density);
    calculated = bridge.radialProfile(reciprocal);
  }

  /**
   * A profile sampled at the shell centers FIRST_SHELL..LAST_SHELL with I = factor * I_calc.
   */
  private ScatteringProfile profile(double factor) {
    int n = LAST_SHELL - FIRST_SHELL + 1;
    double[] q = new double[n];
    double[] intensity = new double[n];
    double[] sigma = new double[n];
    for (int i = 0; i < n; i++) {
      int s = FIRST_SHELL + i;
      q[i] = calculated.getQ(s);
      intensity[i] = factor * calculated.getIntensity(s);
      sigma[i] = 0.05 * intensity[i];
    }
    return new ScatteringProfile(q, intensity, sigma);
  }

  private ReciprocalConstraint constraint(ScatteringProfile profile, ScaleMethod method,
                                          AmplitudeMode mode, boolean weighting) {
    ShellBinning binning = bridge.getShellBinning();
    return new ReciprocalConstraint(new ExperimentalShells(profile, binning, weighting), binning,
        method, mode);
  }

  @Test
  public void testCoverage() {
    ExperimentalShells shells = new ExperimentalShells(profile(1.0), bridge.getShellBinning(), true);
    assertEquals(LAST_SHELL - FIRST_SHELL + 1, shells.getCoveredCount());
    assertFalse(shells.isCovered(0));
    assertFalse(shells.isCovered(FIRST_SHELL - 1));
    assertTrue(shells.isCovered(FIRST_SHELL));
    assertTrue(shells.isCovered(LAST_SHELL));
    assertFalse(shells.isCovered(LAST_SHELL + 1));
    assertTrue(shells.isWeighted());
  }

  @Test
  public void testLeastSquaresScale() {
    ReciprocalConstraint constraint =
        constraint(profile(2.5), ScaleMethod.LEAST_SQUARES, AmplitudeMode.RESCALE, true);
    double scale = constraint.scaleFactor(calculated);
    assertEquals(2.5, scale, 1.0e-10);
    assertEquals(0.0, constraint.residual(calculated, scale), 1.0e-12);
    assertTrue(constraint.residual(calculated, 1.0) > 0.0);

    ReciprocalConstraint firstShell =
        constraint(profile(2.5), ScaleMethod.FIRST_SHELL, AmplitudeMode.RESCALE, false);
    assertEquals(2.5, firstShell.scaleFactor(calculated), 1.0e-10);
  }

  @Test
  public void testUnweightedResidualIsRelative() {
    ReciprocalConstraint constraint =
        constraint(profile(1.0), ScaleMethod.LEAST_SQUARES, AmplitudeMode.RESCALE, false);
    // A zero scale gives sum I_exp^2 / sum I_exp^2.
    assertEquals(1.0, constraint.residual(calculated, 0.0), 1.0e-12);
    assertEquals(1.0, constraint.residual(calculated, Double.NaN), 1.0e-12);
  }

  @Test
  public void testRescaleKeepsPhasesAndPassesThroughUncoveredShells() {
    // Measured intensities on a shape that differs from the calculated one.
    int n = LAST_SHELL - FIRST_SHELL + 1;
    double[] q = new double[n];
    double[] intensity = new double[n];
    double[] sigma = new double[n];
    for (int i = 0; i < n; i++) {
      int s = FIRST_SHELL + i;
      q[i] = calculated.getQ(s);
      intensity[i] = calculated.getIntensity(s) * (1.0 + 0.5 * i);
      sigma[i] = 1.0;
    }
    ReciprocalConstraint constraint = constraint(new ScatteringProfile(q, intensity, sigma),
        ScaleMethod.LEAST_SQUARES, AmplitudeMode.RESCALE, true);
    double scale = constraint.scaleFactor(calculated);
    double[] before = Arrays.copyOf(reciprocal.getData(), reciprocal.getData().length);
    constraint.apply(reciprocal, calculated, scale);

    ShellBinning binning = bridge.getShellBinning();
    double[] after = reciprocal.getData();
    for (int i = 0; i < gridSpace.size(); i++) {
      double re0 = before[2 * i];
      double im0 = before[2 * i + 1];
      double re1 = after[2 * i];
      double im1 = after[2 * i + 1];
      int s = binning.shellOf(i);
      if (s < FIRST_SHELL || s > LAST_SHELL) {
        assertEquals(re0, re1, 0.0);
        assertEquals(im0, im1, 0.0);
      } else {
        double m0 = sqrt(re0 * re0 + im0 * im0);
        double m1 = sqrt(re1 * re1 + im1 * im1);
        // Same direction in the complex plane.
        assertEquals(0.0, re0 * im1 - im0 * re1, 1.0e-8 * m0 * m1 + 1.0e-12);
        assertTrue(re0 * re1 + im0 * im1 >= 0.0);
      }
    }

    CalculatedProfile corrected = bridge.radialProfile(reciprocal);
    for (int i = 0; i < n; i++) {
      int s = FIRST_SHELL + i;
      assertEquals(intensity[i] / scale, corrected.getIntensity(s), 1.0e-8 * intensity[i] / scale);
    }
  }

  @Test
  public void testReplaceSetsUniformShellMagnitude() {
    ReciprocalConstraint constraint =
        constraint(profile(3.0), ScaleMethod.LEAST_SQUARES, AmplitudeMode.REPLACE, true);
    double scale = constraint.scaleFactor(calculated);
    constraint.apply(reciprocal, calculated, scale);
    ShellBinning binning = bridge.getShellBinning();
    for (int i = 0; i < gridSpace.size(); i++) {
      int s = binning.shellOf(i);
      if (s >= FIRST_SHELL && s <= LAST_SHELL) {
        assertEquals(calculated.getIntensity(s), reciprocal.intensity(i),
            1.0e-8 * calculated.getIntensity(s));
      }
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidScaleRejected() {
    ReciprocalConstraint constraint =
        constraint(profile(1.0), ScaleMethod.LEAST_SQUARES, AmplitudeMode.RESCALE, true);
    constraint.apply(reciprocal, calculated, -1.0);
  }

  @Test(expected = ConfigurationException.class)
  public void testProfileOutsideGrid() {
    ScatteringProfile profile = new ScatteringProfile(new double[] {50.0, 60.0},
        new double[] {1.0, 1.0}, new double[] {0.1, 0.1});
    new ExperimentalShells(profile, bridge.getShellBinning(), true);
  }
}
