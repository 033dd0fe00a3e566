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
 * The complex Fourier transform of a {@link DensityGrid}. Values are interleaved (real,
 * imaginary) with X fastest, the layout used by {@link sdx.numerics.fft.Complex3D}.
 *
 * <p>A ReciprocalGrid is a transient view produced by {@link FourierBridge} and owned by the
 * iteration that created it.
 *
 * @since 1.0
 */
public class ReciprocalGrid {

  private final GridSpace gridSpace;
  private final double[] data;

  /**
   * Wrap an interleaved complex array without copying.
   *
   * @param gridSpace the grid geometry.
   * @param data      2 N^3 values.
   */
  ReciprocalGrid(GridSpace gridSpace, double[] data) {
    if (data.length != 2 * gridSpace.size()) {
      throw new IllegalArgumentException(String.format(
          " Reciprocal grid length %d does not match the grid (%d).", data.length, 2 * gridSpace.size()));
    }
    this.gridSpace = gridSpace;
    this.data = data;
  }

  public GridSpace getGridSpace() {
    return gridSpace;
  }

  /**
   * The interleaved backing array. Changes write through.
   *
   * @return the complex values.
   */
  public double[] getData() {
    return data;
  }

  public double real(int index) {
    return data[2 * index];
  }

  public double imaginary(int index) {
    return data[2 * index + 1];
  }

  /**
   * Squared magnitude |F|^2 of a voxel.
   *
   * @param index the voxel index.
   * @return the intensity.
   */
  public double intensity(int index) {
    double re = data[2 * index];
    double im = data[2 * index + 1];
    return re * re + im * im;
  }

  public void set(int index, double re, double im) {
    data[2 * index] = re;
    data[2 * index + 1] = im;
  }

  /**
   * Multiply a voxel by a real factor, leaving its phase unchanged.
   *
   * @param index  the voxel index.
   * @param factor a non-negative factor.
   */
  public void scale(int index, double factor) {
    data[2 * index] *= factor;
    data[2 * index + 1] *= factor;
  }

  public ReciprocalGrid copy() {
    return new ReciprocalGrid(gridSpace, Arrays.copyOf(data, data.length));
  }
}
