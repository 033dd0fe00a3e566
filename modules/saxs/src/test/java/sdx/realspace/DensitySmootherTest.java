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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;
import sdx.saxs.DensityGrid;
import sdx.saxs.GridSpace;
import sdx.utilities.SDXTest;

/**
 * Tests Gaussian smoothing in Fourier space.
 */
public class DensitySmootherTest extends SDXTest {

  private final GridSpace gridSpace = GridSpace.forDensity(24, 1.0);

  @Test
  public void testSmoothingPreservesSum() {
    DensityGrid density = new DensityGrid(gridSpace);
    density.set(12, 12, 12, 1.0);
    double[] smoothed = new DensitySmoother(gridSpace).smooth(density, 2.0);
    double sum = Arrays.stream(smoothed).sum();
    assertEquals(1.0, sum, 1.0e-10);
    assertTrue(smoothed[gridSpace.index(12, 12, 12)] < 1.0);
    assertTrue(smoothed[gridSpace.index(13, 12, 12)] > 0.0);
  }

  @Test
  public void testGaussianWidth() {
    DensityGrid density = new DensityGrid(gridSpace);
    density.set(12, 12, 12, 1.0);
    double sigma = 1.5;
    double[] smoothed = new DensitySmoother(gridSpace).smooth(density, sigma);
    double center = smoothed[gridSpace.index(12, 12, 12)];
    double offset = smoothed[gridSpace.index(14, 12, 12)];
    // A sampled Gaussian falls by exp(-d^2 / (2 sigma^2)) at distance d.
    assertEquals(Math.exp(-4.0 / (2.0 * sigma * sigma)), offset / center, 1.0e-3);
  }

  @Test
  public void testZeroWidthIsCopy() {
    DensityGrid density = new DensityGrid(gridSpace);
    density.set(5, 1.0);
    double[] smoothed = new DensitySmoother(gridSpace).smooth(density, 0.0);
    assertTrue(Arrays.equals(density.getValues(), smoothed));
  }
}
