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
 * Thrown when the support collapsed (or the density became unusable) repeatedly and every restart
 * was used. The run can be retried by the caller with another seed.
 *
 * @since 1.0
 */
public class DivergedReconstructionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final double[] residualHistory;
  private final int iterations;
  private final int restarts;

  /**
   * Constructor for DivergedReconstructionException.
   *
   * @param message         description of the divergence.
   * @param residualHistory residuals of the final attempt.
   * @param iterations      iterations used over all attempts.
   * @param restarts        number of restarts performed.
   */
  public DivergedReconstructionException(String message, double[] residualHistory, int iterations,
                                         int restarts) {
    super(message);
    this.residualHistory = Arrays.copyOf(residualHistory, residualHistory.length);
    this.iterations = iterations;
    this.restarts = restarts;
  }

  /**
   * The residual history of the final attempt.
   *
   * @return a copy of the residuals.
   */
  public double[] getResidualHistory() {
    return Arrays.copyOf(residualHistory, residualHistory.length);
  }

  public int getIterations() {
    return iterations;
  }

  public int getRestarts() {
    return restarts;
  }
}
