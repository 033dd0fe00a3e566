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

import sdx.numerics.fft.Complex3D;
import sdx.saxs.DensityGrid;
import sdx.saxs.GridSpace;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.exp;

/**
 * Periodic Gaussian smoothing of a density by convolution in Fourier space. The Gaussian width is
 * given in voxels; its transfer function is exp(-2 pi^2 sigma^2 |k / N|^2) for the signed
 * frequency index k.
 *
 * @since 1.0
 */
public class DensitySmoother {

  private final GridSpace gridSpace;
  private final Complex3D complex3D;
  private final double[] transfer;
  private double sigma = Double.NaN;

  /**
   * Constructor for DensitySmoother.
   *
   * @param gridSpace the grid geometry.
   */
  public DensitySmoother(GridSpace gridSpace) {
    this.gridSpace = gridSpace;
    int n = gridSpace.getN();
    complex3D = new Complex3D(n, n, n);
    transfer = new double[gridSpace.size()];
  }

  /**
   * Smooth a density.
   *
   * @param density the density (unchanged).
   * @param sigma   the Gaussian width in voxels; zero returns a copy.
   * @return the smoothed values, X fastest.
   */
  public double[] smooth(DensityGrid density, double sigma) {
    if (sigma < 0.0 || Double.isNaN(sigma)) {
      throw new IllegalArgumentException(" The smoothing width must be non-negative: " + sigma);
    }
    double[] values = density.getValues();
    if (sigma == 0.0) {
      return values.clone();
    }
    if (sigma != this.sigma) {
      updateTransfer(sigma);
    }
    int size = values.length;
    double[] data = new double[2 * size];
    for (int i = 0; i < size; i++) {
      data[2 * i] = values[i];
    }
    complex3D.convolution(data);
    double norm = 1.0 / size;
    double[] smoothed = new double[size];
    for (int i = 0; i < size; i++) {
      smoothed[i] = data[2 * i] * norm;
    }
    return smoothed;
  }

  private void updateTransfer(double sigma) {
    int n = gridSpace.getN();
    double[] k2 = new double[n];
    for (int i = 0; i < n; i++) {
      double f = (double) gridSpace.frequency(i) / n;
      k2[i] = f * f;
    }
    double c = -2.0 * PI * PI * sigma * sigma;
    int index = 0;
    for (int k = 0; k < n; k++) {
      for (int j = 0; j < n; j++) {
        for (int i = 0; i < n; i++) {
          transfer[index++] = exp(c * (k2[i] + k2[j] + k2[k]));
        }
      }
    }
    complex3D.setRecip(transfer);
    this.sigma = sigma;
  }
}
