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

import com.act.ciu.model.CIUAnalysisGrid;
import com.act.ciu.model.CIUAxes;
import com.act.ciu.model.CropBounds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Cuts a fingerprint down to the bins nearest a set of axis bounds.
 */
public class GridCropper {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GridCropper.class);

  /**
   * Crops a grid and its axes together.  Each bound is resolved to the index of the nearest axis value, so bounds
   * beyond the data clamp to the first or last bin.  When both bounds of one axis resolve to the same index that
   * axis is left whole, which lets a caller crop only DT or only CV by passing equal values for the other.
   * Otherwise the inclusive index range between the two resolved bounds is kept.
   * @param grid The grid to crop; not modified.
   * @param bounds The axis values to crop to.
   * @return A new grid holding the cropped data and axes.
   */
  public CIUAnalysisGrid crop(CIUAnalysisGrid grid, CropBounds bounds) {
    double[] dt = grid.getAxes().getDtAxis();
    double[] cv = grid.getAxes().getCvAxis();
    double[][] data = grid.getData();

    int dtLow = AxisUtils.nearestIndex(dt, bounds.getDtLow());
    int dtHigh = AxisUtils.nearestIndex(dt, bounds.getDtHigh());
    int cvLow = AxisUtils.nearestIndex(cv, bounds.getCvLow());
    int cvHigh = AxisUtils.nearestIndex(cv, bounds.getCvHigh());

    int rowStart = 0, rowEnd = dt.length - 1;
    if (dtLow != dtHigh) {
      rowStart = Math.min(dtLow, dtHigh);
      rowEnd = Math.max(dtLow, dtHigh);
    }
    int colStart = 0, colEnd = cv.length - 1;
    if (cvLow != cvHigh) {
      colStart = Math.min(cvLow, cvHigh);
      colEnd = Math.max(cvLow, cvHigh);
    }

    double[][] cropped = new double[rowEnd - rowStart + 1][];
    for (int i = rowStart; i <= rowEnd; i++) {
      cropped[i - rowStart] = Arrays.copyOfRange(data[i], colStart, colEnd + 1);
    }
    CIUAxes newAxes = new CIUAxes(
        Arrays.copyOfRange(dt, rowStart, rowEnd + 1),
        Arrays.copyOfRange(cv, colStart, colEnd + 1));

    LOGGER.debug("Cropped %s from %d x %d to %d x %d", grid.getShortName(),
        dt.length, cv.length, newAxes.getDtLength(), newAxes.getCvLength());
    return grid.withData(cropped, newAxes);
  }
}
