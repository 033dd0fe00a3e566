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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.Test;
import sdx.realspace.SupportEstimator.Status;
import sdx.realspace.SupportEstimator.SupportUpdate;
import sdx.saxs.DensityGrid;
import sdx.saxs.GridSpace;
import sdx.saxs.SupportMask;
import sdx.utilities.SDXTest;

/**
 * Tests shrink-wrap support estimation.
 */
public class SupportEstimatorTest extends SDXTest {

  private final GridSpace gridSpace = GridSpace.forDensity(20, 2.0);

  private DensityGrid blob(double radius) {
    DensityGrid density = new DensityGrid(gridSpace);
    SupportMask sphere = SupportMask.sphere(gridSpace, radius);
    Random random = new Random(5);
    for (int i = 0; i < gridSpace.size(); i++) {
      if (sphere.get(i)) {
        density.set(i, 1.0 + 0.1 * random.nextDouble());
      }
    }
    return density;
  }

  private SupportEstimator estimator(double boundingRadius, boolean monotonic) {
    return new SupportEstimator(SupportMask.sphere(gridSpace, boundingRadius),
        new DensitySmoother(gridSpace), monotonic);
  }

  @Test
  public void testVolumeNonIncreasingWithFraction() {
    double[] smoothed = new DensitySmoother(gridSpace).smooth(blob(8.0), 2.0);
    int previous = Integer.MAX_VALUE;
    for (double fraction = 0.05; fraction <= 1.0; fraction += 0.05) {
      boolean[] mask = SupportEstimator.threshold(smoothed, fraction);
      int count = 0;
      for (boolean b : mask) {
        count += b ? 1 : 0;
      }
      assertTrue(count <= previous);
      assertTrue(count > 0);
      previous = count;
    }
  }

  @Test
  public void testTiesAreIncluded() {
    double[] values = {0.0, 0.2, 0.5, 1.0, 0.19};
    boolean[] mask = SupportEstimator.threshold(values, 0.2);
    assertArrayEquals(new boolean[] {false, true, true, true, false}, mask);
    assertArrayEquals(new boolean[] {false, false, false, true, false},
        SupportEstimator.threshold(values, 1.0));
  }

  @Test
  public void testAcceptedMaskWithinBoundsAndPrevious() {
    SupportEstimator estimator = estimator(16.0, true);
    DensityGrid density = blob(8.0);
    SupportMask previous = SupportMask.sphere(gridSpace, 10.0);
    SupportUpdate update = estimator.estimate(density, previous, 1.5, 0.2, false);
    assertEquals(Status.ACCEPTED, update.status());
    assertTrue(update.isAccepted());
    SupportMask mask = update.mask();
    assertTrue(mask.isSubsetOf(previous));
    assertTrue(mask.isSubsetOf(estimator.getBounding()));
    assertTrue(mask.count() > SupportMask.sphere(gridSpace, 6.0).count());
    assertTrue(update.threshold() > 0.0);
  }

  @Test
  public void testBoundingWithoutMonotonicity() {
    SupportEstimator estimator = estimator(6.0, false);
    SupportMask previous = SupportMask.sphere(gridSpace, 2.0);
    SupportUpdate update = estimator.estimate(blob(12.0), previous, 1.0, 0.2, false);
    // The bounding sphere lies inside the thresholded region.
    assertEquals(Status.FULL, update.status());
    assertTrue(update.status().isBad());
    assertFalse(update.mask().isSubsetOf(previous));
  }

  @Test
  public void testEmptyDensityGivesEmptyMask() {
    SupportEstimator estimator = estimator(16.0, true);
    SupportUpdate update = estimator.estimate(new DensityGrid(gridSpace),
        SupportMask.full(gridSpace), 1.5, 0.2, true);
    assertEquals(Status.EMPTY, update.status());
    assertTrue(update.mask().isEmpty());
  }

  @Test
  public void testUniformDensityFillsBounds() {
    SupportEstimator estimator = estimator(12.0, true);
    DensityGrid density = new DensityGrid(gridSpace);
    Arrays.fill(density.getValues(), 2.0);
    SupportUpdate update = estimator.estimate(density, SupportMask.full(gridSpace), 2.0, 0.2, false);
    assertEquals(Status.FULL, update.status());
    assertEquals(estimator.getBounding(), update.mask());
  }

  @Test
  public void testConnectivityKeepsHeavierRegion() {
    DensityGrid density = new DensityGrid(gridSpace);
    // Two separated cubes, the second one denser.
    for (int k = 3; k < 6; k++) {
      for (int j = 3; j < 6; j++) {
        for (int i = 3; i < 6; i++) {
          density.set(i, j, k, 1.0);
          density.set(i + 10, j + 10, k + 10, 2.0);
        }
      }
    }
    SupportEstimator estimator = estimator(40.0, false);
    SupportUpdate update = estimator.estimate(density, SupportMask.full(gridSpace), 0.0, 0.1, true);
    SupportMask mask = update.mask();
    assertTrue(mask.get(14, 14, 14));
    assertFalse(mask.get(4, 4, 4));
    assertEquals(27, mask.count());
  }
}
