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

import com.act.ciu.model.CIUAnalysisGrid;
import com.act.ciu.model.CIURawMatrix;
import com.act.ciu.model.Grids;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Averages replicate fingerprints of one sample, cell by cell.
 */
public class ReplicateAverager {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReplicateAverager.class);

  /**
   * Computes the cell-wise mean and population (biased, no Bessel correction) standard deviation of the replicates.
   * Replicates must all have the same shape; their axes are assumed compatible and are not compared.
   * @param replicates At least one grid.
   * @return The mean as a grid with the first replicate's axes and parameters and every replicate's raw matrix as
   *         provenance, plus the standard deviation grid.
   * @throws com.act.ciu.ShapeMismatchException if any replicate's shape differs from the first one's.
   */
  public AveragedFingerprint average(List<CIUAnalysisGrid> replicates) {
    if (replicates == null || replicates.isEmpty()) {
      throw new IllegalArgumentException("Need at least one replicate to average");
    }

    CIUAnalysisGrid first = replicates.get(0);
    List<double[][]> datas = new ArrayList<>(replicates.size());
    List<CIURawMatrix> provenance = new ArrayList<>(replicates.size());
    for (CIUAnalysisGrid replicate : replicates) {
      double[][] data = replicate.getData();
      Grids.checkSameShape(String.format("Replicate %s vs. %s", replicate.getShortName(), first.getShortName()),
          first.getData(), data);
      datas.add(data);
      provenance.addAll(replicate.getProvenance());
    }

    int rows = first.getNumRows();
    int cols = first.getNumCols();
    double[][] mean = new double[rows][cols];
    double[][] stdDev = new double[rows][cols];
    Mean meanCalc = new Mean();
    StandardDeviation stdDevCalc = new StandardDeviation(false);
    double[] cell = new double[datas.size()];
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < cols; j++) {
        for (int k = 0; k < datas.size(); k++) {
          cell[k] = datas.get(k)[i][j];
        }
        mean[i][j] = meanCalc.evaluate(cell);
        stdDev[i][j] = stdDevCalc.evaluate(cell);
      }
    }

    LOGGER.info("Averaged %d replicates of %d x %d", replicates.size(), rows, cols);
    CIUAnalysisGrid averaged = new CIUAnalysisGrid(provenance, mean, first.getAxes(), first.getParameters());
    return new AveragedFingerprint(averaged, stdDev);
  }

  public static class AveragedFingerprint {
    private final CIUAnalysisGrid average;
    private final double[][] standardDeviation;

    public AveragedFingerprint(CIUAnalysisGrid average, double[][] standardDeviation) {
      this.average = average;
      this.standardDeviation = standardDeviation;
    }

    public CIUAnalysisGrid getAverage() {
      return average;
    }

    public double[][] getStandardDeviation() {
      return Grids.copy(standardDeviation);
    }
  }
}
