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

import static org.apache.commons.math3.util.FastMath.PI;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import sdx.utilities.SDXTest;

/**
 * Tests grid sizing and the real and reciprocal space sampling.
 */
public class GridSpaceTest extends SDXTest {

  @Test
  public void testCreate() {
    GridSpace gridSpace = GridSpace.create(60.0, 5.0, 3.0, 256);
    assertEquals(36, gridSpace.getN());
    assertEquals(180.0, gridSpace.getSide(), 1.0e-12);
    assertEquals(5.0, gridSpace.getVoxelSize(), 1.0e-12);
    assertEquals(2.0 * PI / 180.0, gridSpace.getDq(), 1.0e-12);
    assertEquals(36 * 36 * 36, gridSpace.size());
  }

  @Test
  public void testSizeRaisedToFftFriendlyLength() {
    // 3 * 50 / 4.5 = 33.3 samples, raised to 36.
    GridSpace gridSpace = GridSpace.create(50.0, 4.5, 3.0, 256);
    assertEquals(36, gridSpace.getN());
    assertEquals(150.0 / 36, gridSpace.getVoxelSize(), 1.0e-12);

    assertEquals(8, GridSpace.nextGridSize(7));
    assertEquals(16, GridSpace.nextGridSize(13));
    assertEquals(32, GridSpace.nextGridSize(31));
    assertEquals(50, GridSpace.nextGridSize(50));
  }

  @Test
  public void testCoordinatesAndFrequencies() {
    GridSpace gridSpace = GridSpace.forDensity(8, 2.0);
    assertEquals(0.0, gridSpace.coordinate(4), 0.0);
    assertEquals(-8.0, gridSpace.coordinate(0), 0.0);
    assertEquals(-8.0, gridSpace.getOrigin(), 0.0);
    int[] expected = {0, 1, 2, 3, -4, -3, -2, -1};
    for (int i = 0; i < 8; i++) {
      assertEquals(expected[i], gridSpace.frequency(i));
    }
    double dq = gridSpace.getDq();
    assertEquals(3.0 * dq, gridSpace.maxAxisQ(), 1.0e-12);
    assertEquals(Math.sqrt(3.0) * dq, gridSpace.qMagnitude(1, 7, 1), 1.0e-12);
    assertEquals(1 + 8 * (2 + 8 * 3), gridSpace.index(1, 2, 3));
  }

  @Test(expected = ConfigurationException.class)
  public void testNegativeDimension() {
    GridSpace.create(-10.0, 5.0, 3.0, 256);
  }

  @Test(expected = ConfigurationException.class)
  public void testZeroVoxelSize() {
    GridSpace.create(60.0, 0.0, 3.0, 256);
  }

  @Test(expected = ConfigurationException.class)
  public void testDegenerateGrid() {
    // 3 * 10 / 5 = 6 samples per side.
    GridSpace.create(10.0, 5.0, 3.0, 256);
  }

  @Test
  public void testGridTooLarge() {
    try {
      GridSpace.create(200.0, 1.0, 3.0, 256);
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage().contains("maximum"));
      return;
    }
    throw new AssertionError(" A 600 voxel grid was accepted.");
  }
}
