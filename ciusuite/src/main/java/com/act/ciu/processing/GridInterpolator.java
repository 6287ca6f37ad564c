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
import com.act.ciu.ShapeMismatchException;
import com.act.ciu.model.CIUAnalysisGrid;
import com.act.ciu.model.CIUAxes;
import com.act.ciu.model.Grids;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Linear resampling of CIU grids: along the CV axis to a fixed number of evenly spaced bins, and in both dimensions
 * onto a shared pair of axes so two fingerprints recorded on different axes can be compared cell by cell.
 */
public class GridInterpolator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GridInterpolator.class);

  public static final int MIN_INTERPOLATION_BINS = 2;

  private final LinearInterpolator interpolator = new LinearInterpolator();

  /**
   * Resamples every DT row onto a new CV axis of numBins evenly spaced values running from the first to the last
   * value of the old CV axis.  The DT axis is not touched.
   * @param data The grid to resample.
   * @param axes The grid's axes.
   * @param numBins The number of CV bins to produce.
   * @return The resampled grid (rows x numBins) and its new axes.
   * @throws ConfigurationException if numBins is below two or the CV axis cannot be interpolated over.
   */
  public Pair<double[][], CIUAxes> resampleCv(double[][] data, CIUAxes axes, int numBins)
      throws ConfigurationException {
    if (numBins < MIN_INTERPOLATION_BINS) {
      throw new ConfigurationException(String.format(
          "Interpolation needs at least %d bins, got %d", MIN_INTERPOLATION_BINS, numBins));
    }
    Grids.checkMatchesAxes(data, axes);
    double[] oldCv = axes.getCvAxis();
    AxisUtils.checkInterpolatable(oldCv, "CV");

    double[] newCv = AxisUtils.linspace(oldCv[0], oldCv[oldCv.length - 1], numBins);
    double[][] out = new double[data.length][];
    for (int i = 0; i < data.length; i++) {
      out[i] = interpolate(oldCv, data[i], newCv);
    }
    return Pair.of(out, axes.withCvAxis(newCv));
  }

  public CIUAnalysisGrid resampleCv(CIUAnalysisGrid grid, int numBins) throws ConfigurationException {
    Pair<double[][], CIUAxes> resampled = resampleCv(grid.getData(), grid.getAxes(), numBins);
    return grid.withData(resampled.getLeft(), resampled.getRight());
  }

  /**
   * Bilinear interpolation of a grid onto new DT and CV axes.  Target values beyond the source axes take the value
   * of the nearest edge of the source grid.
   * @param data The source grid.
   * @param axes The source grid's axes.
   * @param targetDt The DT values to produce rows for.
   * @param targetCv The CV values to produce columns for.
   * @return A targetDt.length x targetCv.length grid.
   * @throws ConfigurationException if either source axis cannot be interpolated over.
   */
  public double[][] resample(double[][] data, CIUAxes axes, double[] targetDt, double[] targetCv)
      throws ConfigurationException {
    Grids.checkMatchesAxes(data, axes);
    double[] dt = axes.getDtAxis();
    double[] cv = axes.getCvAxis();
    AxisUtils.checkInterpolatable(dt, "DT");
    AxisUtils.checkInterpolatable(cv, "CV");

    // Linear along CV for every source row, then linear along DT for every new column; on a rectilinear grid this is
    // exactly bilinear interpolation.
    double[][] alongCv = new double[dt.length][];
    for (int i = 0; i < dt.length; i++) {
      alongCv[i] = interpolate(cv, data[i], clampAll(targetCv, cv));
    }

    double[] clampedDt = clampAll(targetDt, dt);
    double[][] out = new double[targetDt.length][targetCv.length];
    for (int j = 0; j < targetCv.length; j++) {
      double[] column = interpolate(dt, Grids.column(alongCv, j), clampedDt);
      for (int i = 0; i < targetDt.length; i++) {
        out[i][j] = column[i];
      }
    }
    return out;
  }

  /**
   * Puts two grids on common axes.  Each reconciled axis runs from the smallest to the largest value found on either
   * grid's axis, with as many bins as the longer of the two, and both grids are bilinearly resampled onto it.
   * @param first The first grid.
   * @param second The second grid.
   * @return Both grids, in order, resampled onto the shared axes.
   * @throws ConfigurationException if any axis is degenerate or not monotonic.
   */
  public Pair<CIUAnalysisGrid, CIUAnalysisGrid> reconcile(CIUAnalysisGrid first, CIUAnalysisGrid second)
      throws ConfigurationException {
    CIUAxes axes1 = first.getAxes();
    CIUAxes axes2 = second.getAxes();

    int numDtBins = Math.max(axes1.getDtLength(), axes2.getDtLength());
    int numCvBins = Math.max(axes1.getCvLength(), axes2.getCvLength());
    AxisUtils.checkInterpolatable(axes1.getDtAxis(), "DT");
    AxisUtils.checkInterpolatable(axes2.getDtAxis(), "DT");
    AxisUtils.checkInterpolatable(axes1.getCvAxis(), "CV");
    AxisUtils.checkInterpolatable(axes2.getCvAxis(), "CV");

    double[] dt = AxisUtils.unionAxis(axes1.getDtAxis(), axes2.getDtAxis(), numDtBins);
    double[] cv = AxisUtils.unionAxis(axes1.getCvAxis(), axes2.getCvAxis(), numCvBins);
    CIUAxes shared = new CIUAxes(dt, cv);
    LOGGER.info("Reconciling %s and %s onto %d DT x %d CV bins",
        first.getShortName(), second.getShortName(), numDtBins, numCvBins);

    double[][] data1 = resample(first.getData(), axes1, dt, cv);
    double[][] data2 = resample(second.getData(), axes2, dt, cv);
    if (Grids.rows(data1) != Grids.rows(data2) || Grids.cols(data1) != Grids.cols(data2)) {
      throw ShapeMismatchException.forShapes("Reconciled grids",
          Grids.rows(data1), Grids.cols(data1), Grids.rows(data2), Grids.cols(data2));
    }
    return Pair.of(first.withData(data1, shared), second.withData(data2, shared));
  }

  /* Linear interpolation of (x, y) at each target; x must be strictly monotonic and every target inside its range. */
  private double[] interpolate(double[] x, double[] y, double[] targets) {
    double[] knots = x;
    double[] values = y;
    if (!AxisUtils.isStrictlyIncreasing(x)) {
      // The spline interpolator needs ascending knots.
      knots = AxisUtils.reversed(x);
      values = AxisUtils.reversed(y);
    }
    PolynomialSplineFunction f = interpolator.interpolate(knots, values);
    double[] out = new double[targets.length];
    for (int i = 0; i < targets.length; i++) {
      out[i] = f.value(targets[i]);
    }
    return out;
  }

  private static double[] clampAll(double[] targets, double[] axis) {
    double lo = Math.min(axis[0], axis[axis.length - 1]);
    double hi = Math.max(axis[0], axis[axis.length - 1]);
    double[] out = new double[targets.length];
    for (int i = 0; i < targets.length; i++) {
      out[i] = Math.max(lo, Math.min(hi, targets[i]));
    }
    return out;
  }
}
