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
package sdx.numerics.fft;

/**
 * Compute the 3D FFT of complex, double precision input of arbitrary dimensions via 1D Mixed Radix
 * FFTs.
 *
 * <p>
 * The location of the input point [x, y, z] within the input array must be:
 * <br>
 * double real = input[x*nextX + y*nextY + z*nextZ] <br>
 * double imag = input[x*nextX + y*nextY + z*nextZ + 1] <br>
 * where <br>
 * int nextX = 2 <br>
 * int nextY = 2*nX <br>
 * int nextZ = 2*nX*nY <br>
 *
 * <p>
 * Instances hold scratch memory and are not thread safe.
 *
 * @see Complex
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Complex3D {

  private final int nX, nY, nZ;
  private final int nextX, nextY, nextZ;
  private final Complex fftX, fftY, fftZ;
  private final double[] recip;

  /**
   * Initialize the 3D FFT for complex 3D matrix.
   *
   * @param nX X-dimension.
   * @param nY Y-dimension.
   * @param nZ Z-dimension.
   */
  public Complex3D(int nX, int nY, int nZ) {
    this.nX = nX;
    this.nY = nY;
    this.nZ = nZ;
    nextX = 2;
    nextY = 2 * nX;
    nextZ = 2 * nX * nY;
    recip = new double[nX * nY * nZ];
    fftX = new Complex(nX);
    fftY = new Complex(nY);
    fftZ = new Complex(nZ);
  }

  /**
   * Determine the index of the complex number in the 1D array from the X, Y and Z indices.
   *
   * @param i  the index along the X-axis.
   * @param j  the index along the Y-axis.
   * @param k  the index along the Z-axis.
   * @param nX the number of points along the X-axis.
   * @param nY the number of points along the Y-axis.
   * @return the index of the complex number in the 1D array.
   */
  public static int interleavedIndex(int i, int j, int k, int nX, int nY) {
    return 2 * (i + nX * (j + nY * k));
  }

  /**
   * Compute the 3D FFT.
   *
   * @param input The input array must be of size 2 * nX * nY * nZ.
   */
  public void fft(final double[] input) {
    for (int z = 0; z < nZ; z++) {
      for (int offset = z * nextZ, y = 0; y < nY; y++, offset += nextY) {
        fftX.fft(input, offset, nextX);
      }
      for (int offset = z * nextZ, x = 0; x < nX; x++, offset += nextX) {
        fftY.fft(input, offset, nextY);
      }
    }
    for (int offset = 0, y = 0; y < nY; y++) {
      for (int x = 0; x < nX; x++, offset += nextX) {
        fftZ.fft(input, offset, nextZ);
      }
    }
  }

  /**
   * Compute the inverse 3D FFT. The result is not normalized (i.e. it is scaled by nX*nY*nZ).
   *
   * @param input The input array must be of size 2 * nX * nY * nZ.
   */
  public void ifft(final double[] input) {
    for (int offset = 0, y = 0; y < nY; y++) {
      for (int x = 0; x < nX; x++, offset += nextX) {
        fftZ.ifft(input, offset, nextZ);
      }
    }
    for (int z = 0; z < nZ; z++) {
      for (int offset = z * nextZ, x = 0; x < nX; x++, offset += nextX) {
        fftY.ifft(input, offset, nextY);
      }
      for (int offset = z * nextZ, y = 0; y < nY; y++, offset += nextY) {
        fftX.ifft(input, offset, nextX);
      }
    }
  }

  /**
   * Perform a convolution: forward transform, multiplication of each reciprocal space point by the
   * real factor set with {@link #setRecip(double[])}, and an inverse transform. As with ifft, the
   * result is scaled by nX*nY*nZ.
   *
   * @param input The input array.
   */
  public void convolution(final double[] input) {
    fft(input);
    for (int i = 0, index = 0; i < recip.length; i++, index += 2) {
      double r = recip[i];
      input[index] *= r;
      input[index + 1] *= r;
    }
    ifft(input);
  }

  /**
   * Setter for the field <code>recip</code>.
   *
   * @param recip the real reciprocal space factors, ordered with X fastest then Y then Z.
   */
  public void setRecip(double[] recip) {
    if (recip.length != this.recip.length) {
      throw new IllegalArgumentException(
          " Reciprocal space factors must have length " + this.recip.length + ": " + recip.length);
    }
    System.arraycopy(recip, 0, this.recip, 0, recip.length);
  }
}
