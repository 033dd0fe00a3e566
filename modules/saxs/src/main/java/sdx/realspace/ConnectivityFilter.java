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

/**
 * Labels the 6-connected regions of a mask and keeps the one holding the most density. The grid
 * is not treated as periodic.
 *
 * @since 1.0
 */
public final class ConnectivityFilter {

  private ConnectivityFilter() {
  }

  /**
   * Keep the connected region of the mask with the largest summed density.
   *
   * @param mask    N^3 flags, X fastest.
   * @param density N^3 density values used to rank the regions.
   * @param n       samples per side.
   * @return a new mask holding one region; all false when the input mask is empty.
   */
  public static boolean[] largestRegion(boolean[] mask, double[] density, int n) {
    int size = mask.length;
    int[] label = new int[size];
    int[] queue = new int[size];
    int bestLabel = 0;
    double bestSum = Double.NEGATIVE_INFINITY;
    int nextLabel = 0;
    int nn = n * n;
    for (int seed = 0; seed < size; seed++) {
      if (!mask[seed] || label[seed] != 0) {
        continue;
      }
      nextLabel++;
      double sum = 0.0;
      int head = 0;
      int tail = 0;
      queue[tail++] = seed;
      label[seed] = nextLabel;
      while (head < tail) {
        int index = queue[head++];
        sum += density[index];
        int i = index % n;
        int j = (index / n) % n;
        int k = index / nn;
        if (i > 0) {
          tail = visit(index - 1, mask, label, nextLabel, queue, tail);
        }
        if (i < n - 1) {
          tail = visit(index + 1, mask, label, nextLabel, queue, tail);
        }
        if (j > 0) {
          tail = visit(index - n, mask, label, nextLabel, queue, tail);
        }
        if (j < n - 1) {
          tail = visit(index + n, mask, label, nextLabel, queue, tail);
        }
        if (k > 0) {
          tail = visit(index - nn, mask, label, nextLabel, queue, tail);
        }
        if (k < n - 1) {
          tail = visit(index + nn, mask, label, nextLabel, queue, tail);
        }
      }
      if (sum > bestSum) {
        bestSum = sum;
        bestLabel = nextLabel;
      }
    }
    boolean[] result = new boolean[size];
    if (bestLabel == 0) {
      return result;
    }
    for (int i = 0; i < size; i++) {
      result[i] = label[i] == bestLabel;
    }
    return result;
  }

  private static int visit(int index, boolean[] mask, int[] label, int current, int[] queue,
                           int tail) {
    if (mask[index] && label[index] == 0) {
      label[index] = current;
      queue[tail++] = index;
    }
    return tail;
  }
}
