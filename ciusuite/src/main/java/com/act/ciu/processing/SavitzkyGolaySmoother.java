/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.act.ciu.processing;

import com.act.ciu.ConfigurationException;
import com.act.ciu.model.Grids;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Savitzky-Golay (quadratic local least squares) smoothing applied down each CV column, i.e. along drift time.
 *
 * Every output point is the value at that point of a quadratic fit to the window of points around it.  Within half a
 * window of either end of a column there is no centered window, so the quadratic fit to the first (or last) full
 * window is evaluated at the edge points instead.  No padding is introduced.
 */
public class SavitzkyGolaySmoother {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SavitzkyGolaySmoother.class);

  public static final int POLYNOMIAL_ORDER = 2;

  /**
   * Even window lengths have no center point, so they are bumped up to the next odd length.
   * @param window The requested window length.
   * @return The window length that will actually be used.
   */
  public static int effectiveWindow(int window) {
    return window % 2 == 0 ? window + 1 : window;
  }

  /**
   * Smooths every column of a grid, repeating the whole pass a number of times.
   * @param data The grid to smooth; not modified.
   * @param window The window length in DT bins; even values are incremented by one.
   * @param iterations How many passes to run.  Zero returns a copy of the input.
   * @return A smoothed grid of the same shape as the input.
   * @throws ConfigurationException if the window is too short for a quadratic fit or longer than a column.
   */
  public double[][] smooth(double[][] data, int window, int iterations) throws ConfigurationException {
    Grids.checkRectangular(data);
    if (iterations < 0) {
      throw new ConfigurationException(String.format("Smoothing iterations must not be negative, got %d", iterations));
    }
    if (iterations == 0) {
      return Grids.copy(data);
    }

    int w = effectiveWindow(window);
    if (w != window) {
      LOGGER.debug("Smoothing window %d is even, using %d", window, w);
    }
    if (w <= POLYNOMIAL_ORDER) {
      throw new ConfigurationException(String.format(
          "Smoothing window %d is too short for a polynomial of order %d", w, POLYNOMIAL_ORDER));
    }
    int rows = Grids.rows(data);
    if (rows > 0 && w > rows) {
      throw new ConfigurationException(String.format(
          "Smoothing window %d is longer than the %d drift time bins available", w, rows));
    }

    double[][] hat = hatMatrix(w);
    double[][] current = Grids.copy(data);
    for (int iter = 0; iter < iterations; iter++) {
      current = smoothColumns(current, hat);
    }
    return current;
  }

  /* The hat matrix H = A (A^T A)^-1 A^T for the w x (order + 1) Vandermonde matrix A over window offsets.  Row k of H
   * holds the weights that give the least squares fit's value at offset k of the window. */
  static double[][] hatMatrix(int window) {
    int half = window / 2;
    double[][] vandermonde = new double[window][POLYNOMIAL_ORDER + 1];
    for (int k = 0; k < window; k++) {
      double x = k - half;
      double term = 1.0;
      for (int p = 0; p <= POLYNOMIAL_ORDER; p++) {
        vandermonde[k][p] = term;
        term *= x;
      }
    }
    RealMatrix a = MatrixUtils.createRealMatrix(vandermonde);
    // For a tall, full column rank matrix the QR solver's inverse is the least squares pseudo-inverse.
    RealMatrix pseudoInverse = new QRDecomposition(a).getSolver().getInverse();
    return a.multiply(pseudoInverse).getData();
  }

  private double[][] smoothColumns(double[][] data, double[][] hat) {
    int rows = Grids.rows(data);
    int cols = Grids.cols(data);
    double[][] out = new double[rows][cols];
    for (int j = 0; j < cols; j++) {
      double[] smoothed = smoothColumn(Grids.column(data, j), hat);
      for (int i = 0; i < rows; i++) {
        out[i][j] = smoothed[i];
      }
    }
    return out;
  }

  private double[] smoothColumn(double[] column, double[][] hat) {
    int n = column.length;
    int w = hat.length;
    int half = w / 2;
    double[] out = new double[n];

    for (int i = 0; i < n; i++) {
      int windowStart;
      int hatRow;
      if (i < half) {
        windowStart = 0;
        hatRow = i;
      } else if (i >= n - half) {
        windowStart = n - w;
        hatRow = i - windowStart;
      } else {
        windowStart = i - half;
        hatRow = half;
      }

      double sum = 0.0;
      for (int k = 0; k < w; k++) {
        sum += hat[hatRow][k] * column[windowStart + k];
      }
      out[i] = sum;
    }
    return out;
  }
}
