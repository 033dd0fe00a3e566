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
import java.util.logging.Logger;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.abs;

/**
 * Computes the scattering profile of an electron density: the shell averaged |F|^2 of its Fourier
 * transform, up to the largest positive axis frequency. Sigma is set to 3% of the first
 * intensity.
 *
 * <p>The density may first be sub-sampled by an integer stride, thresholded (|rho| at or below
 * the threshold set to zero) and zero padded about its center to a larger grid for a finer q
 * spacing.
 *
 * @since 1.0
 */
public class ProfileCalculator {

  private static final Logger logger = Logger.getLogger(ProfileCalculator.class.getName());

  /**
   * Relative uncertainty assigned to every point, as a fraction of the first intensity.
   */
  public static final double RELATIVE_SIGMA = 0.03;

  private int stride = 1;
  private double threshold = Double.NaN;
  private int paddedSize = 0;
  private double dq = Double.NaN;

  /**
   * Use every stride'th voxel along each axis.
   *
   * @param stride a positive stride.
   * @return this calculator.
   */
  public ProfileCalculator setStride(int stride) {
    if (stride < 1) {
      throw new ConfigurationException(format(" The sampling stride must be positive: %d", stride));
    }
    this.stride = stride;
    return this;
  }

  /**
   * Set voxels with |rho| at or below the threshold to zero; NaN disables the threshold.
   *
   * @param threshold the density threshold.
   * @return this calculator.
   */
  public ProfileCalculator setThreshold(double threshold) {
    this.threshold = threshold;
    return this;
  }

  /**
   * Pad the density with zeros to n samples per side. Takes precedence over {@link #setDq}.
   *
   * @param n the padded grid size; 0 disables padding.
   * @return this calculator.
   */
  public ProfileCalculator setPaddedSize(int n) {
    this.paddedSize = n;
    return this;
  }

  /**
   * Pad the density with zeros to reach the requested q spacing.
   *
   * @param dq the q spacing in inverse Angstrom; NaN disables padding.
   * @return this calculator.
   */
  public ProfileCalculator setDq(double dq) {
    this.dq = dq;
    return this;
  }

  /**
   * Compute the profile.
   *
   * @param density the density (unchanged).
   * @return the profile.
   */
  public ScatteringProfile calculate(DensityGrid density) {
    int n = density.getN();
    double voxel = density.getVoxelSize();
    double[] rho = density.getValues();

    // An odd grid loses its last plane along each axis.
    if (n % 2 == 1) {
      rho = crop(rho, n, n - 1);
      n = n - 1;
    }
    double side = n * voxel;
    if (stride > 1) {
      int m = (n + stride - 1) / stride;
      rho = subsample(rho, n, m, stride);
      n = m;
      voxel = side / n;
    } else {
      rho = Arrays.copyOf(rho, rho.length);
    }
    if (!Double.isNaN(threshold)) {
      for (int i = 0; i < rho.length; i++) {
        if (abs(rho[i]) <= threshold) {
          rho[i] = 0.0;
        }
      }
    }

    int target = n;
    if (paddedSize > 0) {
      if (paddedSize < n) {
        logger.info(format(" Requested grid size %d is below the density grid size %d; padding skipped.",
            paddedSize, n));
      } else {
        target = paddedSize;
      }
    } else if (!Double.isNaN(dq)) {
      double current = 2.0 * PI / side;
      double desired = dq;
      if (desired > current) {
        logger.info(format(" Requested dq %8.5f exceeds the density dq %8.5f; using %8.5f.",
            desired, current, current));
        desired = current;
      }
      target = (int) (2.0 * PI / desired / voxel);
      if (target % 2 == 1) {
        target++;
      }
      target = Math.max(target, n);
    }
    if (target > n) {
      rho = pad(rho, n, target);
      n = target;
    }

    GridSpace gridSpace = GridSpace.forDensity(n, voxel);
    FourierBridge bridge = new FourierBridge(gridSpace);
    CalculatedProfile calculated =
        bridge.radialProfile(bridge.forward(new DensityGrid(gridSpace, rho)));
    double qLimit = gridSpace.maxAxisQ();
    logger.fine(format(" Profile grid: N = %d, dq = %8.5f 1/A, q limit %8.5f 1/A",
        n, gridSpace.getDq(), qLimit));

    int size = calculated.size();
    double[] q = new double[size];
    double[] intensity = new double[size];
    int count = 0;
    for (int s = 0; s < size; s++) {
      if (calculated.isValid(s) && calculated.getQ(s) < qLimit) {
        q[count] = calculated.getQ(s);
        intensity[count] = calculated.getIntensity(s);
        count++;
      }
    }
    q = Arrays.copyOf(q, count);
    intensity = Arrays.copyOf(intensity, count);
    double[] sigma = new double[count];
    if (count > 0) {
      Arrays.fill(sigma, RELATIVE_SIGMA * intensity[0]);
    }
    return new ScatteringProfile(q, intensity, sigma);
  }

  private static double[] crop(double[] rho, int n, int m) {
    double[] result = new double[m * m * m];
    for (int k = 0; k < m; k++) {
      for (int j = 0; j < m; j++) {
        System.arraycopy(rho, n * (j + n * k), result, m * (j + m * k), m);
      }
    }
    return result;
  }

  private static double[] subsample(double[] rho, int n, int m, int stride) {
    double[] result = new double[m * m * m];
    int index = 0;
    for (int k = 0; k < m; k++) {
      for (int j = 0; j < m; j++) {
        for (int i = 0; i < m; i++) {
          result[index++] = rho[i * stride + n * (j * stride + n * (k * stride))];
        }
      }
    }
    return result;
  }

  /**
   * Zero pad an n^3 density to m^3, keeping it centered.
   */
  private static double[] pad(double[] rho, int n, int m) {
    double[] result = new double[m * m * m];
    int offset = m / 2 - n / 2;
    for (int k = 0; k < n; k++) {
      for (int j = 0; j < n; j++) {
        System.arraycopy(rho, n * (j + n * k), result,
            offset + m * ((j + offset) + m * (k + offset)), n);
      }
    }
    return result;
  }
}
