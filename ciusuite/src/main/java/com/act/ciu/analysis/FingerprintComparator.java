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

package com.act.ciu.analysis;

import com.act.ciu.ConfigurationException;
import com.act.ciu.model.CIUAnalysisGrid;
import com.act.ciu.model.CIUAxes;
import com.act.ciu.model.Grids;
import com.act.ciu.processing.AxisUtils;
import com.act.ciu.processing.GridInterpolator;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Pairwise comparison of two fingerprints: the cell-wise difference and an RMSD score in percent.
 */
public class FingerprintComparator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FingerprintComparator.class);

  // Intensities below this are baseline noise and are zeroed before differencing.
  public static final double NOISE_FLOOR = 0.1;

  // Axis values closer than this are considered the same bin.
  private static final double AXIS_VALUE_TOLERANCE = 1e-6;

  private final GridInterpolator interpolator;

  public FingerprintComparator() {
    this(new GridInterpolator());
  }

  public FingerprintComparator(GridInterpolator interpolator) {
    this.interpolator = interpolator;
  }

  /**
   * Compares two fingerprints.  If their DT or CV axes differ in length both are first resampled onto shared axes
   * (see {@link GridInterpolator#reconcile}).  Axes of equal length are taken to be compatible; if their values
   * differ anyway that is logged, but no resampling is done.
   * @param first The grid subtracted from.
   * @param second The grid subtracted.
   * @return The difference (first - second) with the axes it is laid out on, and the RMSD.
   * @throws ConfigurationException if reconciliation is needed but an axis cannot be interpolated over.
   */
  public ComparisonResult compare(CIUAnalysisGrid first, CIUAnalysisGrid second) throws ConfigurationException {
    CIUAxes axes1 = first.getAxes();
    CIUAxes axes2 = second.getAxes();

    CIUAnalysisGrid a = first;
    CIUAnalysisGrid b = second;
    boolean interpolated = false;
    if (axes1.getDtLength() != axes2.getDtLength() || axes1.getCvLength() != axes2.getCvLength()) {
      LOGGER.warn("Axes of %s and %s do not match (%s vs. %s); interpolating to compare",
          first.getShortName(), second.getShortName(), axes1, axes2);
      Pair<CIUAnalysisGrid, CIUAnalysisGrid> reconciled = interpolator.reconcile(first, second);
      a = reconciled.getLeft();
      b = reconciled.getRight();
      interpolated = true;
    } else if (!AxisUtils.sameValues(axes1.getDtAxis(), axes2.getDtAxis(), AXIS_VALUE_TOLERANCE) ||
        !AxisUtils.sameValues(axes1.getCvAxis(), axes2.getCvAxis(), AXIS_VALUE_TOLERANCE)) {
      LOGGER.warn("Axes of %s and %s have the same lengths but different values; comparing bin by bin anyway",
          first.getShortName(), second.getShortName());
    }

    Pair<double[][], Double> differenceAndRmsd = rmsdDifference(a.getData(), b.getData());
    LOGGER.info("RMSD of %s vs. %s: %.2f", first.getShortName(), second.getShortName(), differenceAndRmsd.getRight());
    return new ComparisonResult(differenceAndRmsd.getLeft(), a.getAxes(), differenceAndRmsd.getRight(), interpolated);
  }

  /**
   * Zeroes everything below {@link #NOISE_FLOOR} in copies of both grids, then computes D = A - B and
   * RMSD = sqrt(sum(D^2) / (nonzero(A) + nonzero(B))) * 100.  The denominator counts the cells that carry signal in
   * either fingerprint rather than the grid area.  If neither grid has any signal left the RMSD is 0.
   * @param data1 Grid A; not modified.
   * @param data2 Grid B, the same shape as A; not modified.
   * @return The difference grid and the RMSD in percent.
   * @throws com.act.ciu.ShapeMismatchException if the grids differ in shape.
   */
  public static Pair<double[][], Double> rmsdDifference(double[][] data1, double[][] data2) {
    Grids.checkSameShape("Comparison operands", data1, data2);
    double[][] a = applyNoiseFloor(data1);
    double[][] b = applyNoiseFloor(data2);

    int rows = Grids.rows(a);
    int cols = Grids.cols(a);
    double[][] difference = new double[rows][cols];
    double sumOfSquares = 0.0;
    long nonZeroCount = 0;
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < cols; j++) {
        double d = a[i][j] - b[i][j];
        difference[i][j] = d;
        sumOfSquares += d * d;
        if (a[i][j] != 0.0) nonZeroCount++;
        if (b[i][j] != 0.0) nonZeroCount++;
      }
    }

    // No signal on either side means every difference is zero as well.
    double rmsd = nonZeroCount == 0 ? 0.0 : Math.sqrt(sumOfSquares / nonZeroCount) * 100.0;
    return Pair.of(difference, rmsd);
  }

  static double[][] applyNoiseFloor(double[][] data) {
    double[][] out = Grids.copy(data);
    for (double[] row : out) {
      for (int j = 0; j < row.length; j++) {
        if (row[j] < NOISE_FLOOR) {
          row[j] = 0.0;
        }
      }
    }
    return out;
  }

  public static class ComparisonResult {
    private final double[][] difference;
    private final CIUAxes axes;
    private final double rmsd;
    private final boolean interpolated;

    public ComparisonResult(double[][] difference, CIUAxes axes, double rmsd, boolean interpolated) {
      this.difference = difference;
      this.axes = axes;
      this.rmsd = rmsd;
      this.interpolated = interpolated;
    }

    public double[][] getDifference() {
      return Grids.copy(difference);
    }

    public CIUAxes getAxes() {
      return axes;
    }

    /**
     * @return The RMSD in percent.
     */
    public double getRmsd() {
      return rmsd;
    }

    /**
     * @return True if the operands had to be resampled onto shared axes first.
     */
    public boolean wasInterpolated() {
      return interpolated;
    }
  }
}
