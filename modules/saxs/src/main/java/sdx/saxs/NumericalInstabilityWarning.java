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

/**
 * A non-fatal numerical anomaly observed during one iteration.
 *
 * @param iteration the iteration (0-based, within its attempt) that produced the anomaly.
 * @param kind      the kind of anomaly.
 * @param magnitude a measure of its size (relative imaginary residue, scale factor, ...).
 * @since 1.0
 */
public record NumericalInstabilityWarning(int iteration, Kind kind, double magnitude) {

  /**
   * Kinds of numerical anomalies.
   */
  public enum Kind {
    /** The inverse transform left a non-negligible imaginary component. */
    IMAGINARY_RESIDUE,
    /** The intensity scale factor was not a positive finite number. */
    INVALID_SCALE,
    /** The density contains NaN or infinite values. */
    NON_FINITE_DENSITY
  }

  @Override
  public String toString() {
    return format(" Iteration %d: %s (%10.4e)", iteration, kind, magnitude);
  }
}
