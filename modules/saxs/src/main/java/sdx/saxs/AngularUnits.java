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

/**
 * Units of the momentum transfer q.
 *
 * @since 1.0
 */
public enum AngularUnits {

  /** Inverse Angstrom (the internal unit). */
  ANGSTROM(1.0),
  /** Inverse nanometer. */
  NANOMETER(0.1);

  private final double toInverseAngstrom;

  AngularUnits(double toInverseAngstrom) {
    this.toInverseAngstrom = toInverseAngstrom;
  }

  /**
   * Convert a q value in these units to inverse Angstrom.
   *
   * @param q the momentum transfer in these units.
   * @return q in inverse Angstrom.
   */
  public double toInverseAngstrom(double q) {
    return q * toInverseAngstrom;
  }

  /**
   * Parse a unit label ("a", "angstrom", "nm", "nanometer"), case insensitive.
   *
   * @param label the label.
   * @return the units.
   */
  public static AngularUnits parse(String label) {
    return switch (label.trim().toLowerCase()) {
      case "a", "angstrom", "1/a" -> ANGSTROM;
      case "nm", "nanometer", "1/nm" -> NANOMETER;
      default -> throw new ConfigurationException(" Unknown angular units: " + label);
    };
  }
}
