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

import java.util.Locale;

import static java.lang.String.format;

/**
 * How voxel magnitudes are corrected toward the measured shell intensity. The phase is kept in
 * both modes.
 *
 * @since 1.0
 */
public enum AmplitudeMode {

  /**
   * Multiply each voxel of a shell by sqrt(I_exp / (s I_calc)).
   */
  RESCALE,
  /**
   * Give every voxel of a shell the magnitude sqrt(I_exp / s).
   */
  REPLACE;

  /**
   * Parse a configuration value, ignoring case.
   *
   * @param value the name of the mode.
   * @return the mode.
   * @throws ConfigurationException for an unknown name.
   */
  public static AmplitudeMode parse(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(format(" Unknown amplitude mode: %s", value), e);
    }
  }
}
