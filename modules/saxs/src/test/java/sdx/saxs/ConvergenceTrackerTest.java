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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import sdx.utilities.SDXTest;

/**
 * Tests the stopping rules of the convergence tracker.
 */
public class ConvergenceTrackerTest extends SDXTest {

  @Test
  public void testMaxIterations() {
    ConvergenceTracker tracker = new ConvergenceTracker(5, 100, 1.0e-3, 0.0);
    for (int i = 0; i < 4; i++) {
      tracker.update(10.0 - i, true);
      assertNull(tracker.check(i + 1));
    }
    tracker.update(1.0, true);
    assertEquals(TerminationReason.MAX_ITERATIONS, tracker.check(5));
    assertEquals(5, tracker.size());
    assertEquals(1.0, tracker.getBest(), 0.0);
    assertEquals(4, tracker.getBestIteration());
  }

  @Test
  public void testPlateauNeedsArming() {
    ConvergenceTracker tracker = new ConvergenceTracker(1000, 10, 1.0e-3, 0.0);
    for (int i = 0; i < 50; i++) {
      tracker.update(1.0, false);
      assertNull(tracker.check(i + 1));
    }
    for (int i = 0; i < 9; i++) {
      tracker.update(1.0, true);
      assertNull(tracker.check(51 + i));
    }
    tracker.update(1.0, true);
    assertEquals(TerminationReason.PLATEAU, tracker.check(60));
  }

  @Test
  public void testNoPlateauWhileImproving() {
    ConvergenceTracker tracker = new ConvergenceTracker(1000, 10, 1.0e-3, 0.0);
    double residual = 1.0;
    for (int i = 0; i < 200; i++) {
      residual *= 0.99;
      tracker.update(residual, true);
      assertFalse(tracker.isPlateau());
      assertNull(tracker.check(i + 1));
    }
  }

  @Test
  public void testPlateauAfterImprovementStops() {
    ConvergenceTracker tracker = new ConvergenceTracker(1000, 10, 1.0e-3, 0.0);
    double residual = 1.0;
    int iteration = 0;
    for (int i = 0; i < 30; i++) {
      residual *= 0.9;
      tracker.update(residual, true);
      assertNull(tracker.check(++iteration));
    }
    TerminationReason reason = null;
    int extra = 0;
    while (reason == null) {
      // Noise above the best residual: the best in the window no longer improves.
      tracker.update(residual * (1.0 + 0.1 * (extra % 3)), true);
      reason = tracker.check(++iteration);
      extra++;
    }
    assertEquals(TerminationReason.PLATEAU, reason);
    assertEquals(10, extra);
  }

  @Test
  public void testThreshold() {
    ConvergenceTracker tracker = new ConvergenceTracker(1000, 100, 1.0e-3, 0.5);
    tracker.update(1.0, false);
    assertNull(tracker.check(1));
    tracker.update(0.4, false);
    assertEquals(TerminationReason.THRESHOLD, tracker.check(2));
  }

  @Test
  public void testMaxIterationsTakesPrecedence() {
    ConvergenceTracker tracker = new ConvergenceTracker(2, 1, 1.0e-3, 10.0);
    tracker.update(1.0, true);
    tracker.update(1.0, true);
    assertTrue(tracker.isPlateau());
    assertEquals(TerminationReason.MAX_ITERATIONS, tracker.check(2));
  }
}
