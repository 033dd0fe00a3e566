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

import java.util.logging.Logger;

import sdx.numerics.fft.Complex3D;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The FourierBridge class moves densities between real and reciprocal space on one
 * {@link GridSpace}, and bins reciprocal space intensities into shells.
 *
 * <p>The forward transform is unnormalized, the inverse divides by N^3, so
 * inverse(forward(rho)) reproduces rho. An instance owns FFT scratch space and is not thread safe.
 *
 * @since 1.0
 */
public class FourierBridge {

  private static final Logger logger = Logger.getLogger(FourierBridge.class.getName());

  private final GridSpace gridSpace;
  private final Complex3D complex3D;
  private ShellBinning shellBinning;
  private double imaginaryResidue;

  /**
   * Constructor for FourierBridge.
   *
   * @param gridSpace the grid geometry.
   */
  public FourierBridge(GridSpace gridSpace) {
    this.gridSpace = gridSpace;
    int n = gridSpace.getN();
    complex3D = new Complex3D(n, n, n);
  }

  public GridSpace getGridSpace() {
    return gridSpace;
  }

  /**
   * 3D discrete Fourier transform of a real density.
   *
   * @param density the density.
   * @return a new reciprocal grid.
   */
  public ReciprocalGrid forward(DensityGrid density) {
    checkShape(density.getGridSpace());
    double[] values = density.getValues();
    double[] data = new double[2 * values.length];
    for (int i = 0; i < values.length; i++) {
      data[2 * i] = values[i];
    }
    complex3D.fft(data);
    return new ReciprocalGrid(gridSpace, data);
  }

  /**
   * Inverse 3D transform. The real part is returned; the largest imaginary component relative to
   * the largest real magnitude is available from {@link #getImaginaryResidue()}.
   *
   * @param reciprocal the reciprocal grid (unchanged).
   * @return a new density.
   */
  public DensityGrid inverse(ReciprocalGrid reciprocal) {
    checkShape(reciprocal.getGridSpace());
    double[] data = reciprocal.getData().clone();
    complex3D.ifft(data);
    int size = gridSpace.size();
    double norm = 1.0 / size;
    DensityGrid density = new DensityGrid(gridSpace);
    double[] values = density.getValues();
    double maxReal = 0.0;
    double maxImaginary = 0.0;
    for (int i = 0; i < size; i++) {
      double re = data[2 * i] * norm;
      double im = abs(data[2 * i + 1] * norm);
      values[i] = re;
      maxReal = Math.max(maxReal, abs(re));
      maxImaginary = Math.max(maxImaginary, im);
    }
    if (maxReal > 0.0) {
      imaginaryResidue = maxImaginary / maxReal;
    } else {
      imaginaryResidue = (maxImaginary > 0.0) ? Double.POSITIVE_INFINITY : 0.0;
    }
    return density;
  }

  /**
   * Relative imaginary residue left by the last call to {@link #inverse(ReciprocalGrid)}.
   *
   * @return max |Im| / max |Re|.
   */
  public double getImaginaryResidue() {
    return imaginaryResidue;
  }

  /**
   * Shell membership for this grid, computed on first use.
   *
   * @return the shell binning.
   */
  public ShellBinning getShellBinning() {
    if (shellBinning == null) {
      shellBinning = new ShellBinning(gridSpace);
      logger.fine(shellBinning.toString());
    }
    return shellBinning;
  }

  /**
   * Mean |F|^2 over each shell.
   *
   * @param reciprocal the reciprocal grid.
   * @return the calculated profile.
   */
  public CalculatedProfile radialProfile(ReciprocalGrid reciprocal) {
    checkShape(reciprocal.getGridSpace());
    ShellBinning binning = getShellBinning();
    int nShells = binning.getNumberOfShells();
    double[] sum = new double[nShells];
    int size = gridSpace.size();
    for (int i = 0; i < size; i++) {
      sum[binning.shellOf(i)] += reciprocal.intensity(i);
    }
    boolean[] valid = new boolean[nShells];
    for (int s = 0; s < nShells; s++) {
      int count = binning.count(s);
      if (count > 0) {
        sum[s] /= count;
        valid[s] = true;
      }
    }
    return new CalculatedProfile(binning.getCenters(), sum, valid);
  }

  /**
   * Root mean square relative difference between two densities, used to check transforms.
   *
   * @param a the reference density.
   * @param b the other density.
   * @return ||a - b|| / ||a||, or ||b|| when a is zero.
   */
  public static double relativeDifference(DensityGrid a, DensityGrid b) {
    double num = 0.0;
    double den = 0.0;
    double[] va = a.getValues();
    double[] vb = b.getValues();
    for (int i = 0; i < va.length; i++) {
      double d = va[i] - vb[i];
      num += d * d;
      den += va[i] * va[i];
    }
    if (den == 0.0) {
      return sqrt(num);
    }
    return sqrt(num / den);
  }

  private void checkShape(GridSpace other) {
    if (other.getN() != gridSpace.getN()) {
      throw new IllegalArgumentException(format(
          " Grid size %d does not match this transform (%d).", other.getN(), gridSpace.getN()));
    }
  }
}
