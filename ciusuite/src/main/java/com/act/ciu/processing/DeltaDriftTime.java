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
import com.act.ciu.model.Grids;

/**
 * Re-centers a fingerprint's drift time axis on the most intense DT bin of its first CV column, so fingerprints of
 * species with different absolute drift times can be lined up.
 */
public class DeltaDriftTime {

  /**
   * @param grid The grid to shift; not modified.
   * @return A new grid with the same data and CV axis whose DT axis has the centroid subtracted from every value.
   */
  public CIUAnalysisGrid shift(CIUAnalysisGrid grid) {
    if (grid.getNumRows() == 0 || grid.getNumCols() == 0) {
      throw new IllegalArgumentException("Cannot find a drift time centroid in an empty grid");
    }
    double[] dt = grid.getAxes().getDtAxis();
    double centroid = dt[AxisUtils.argMax(Grids.column(grid.getData(), 0))];

    double[] shifted = new double[dt.length];
    for (int i = 0; i < dt.length; i++) {
      shifted[i] = dt[i] - centroid;
    }
    return grid.withData(grid.getData(), grid.getAxes().withDtAxis(shifted));
  }
}
