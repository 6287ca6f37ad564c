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

import com.act.ciu.model.Grids;

/**
 * Scales each collision voltage column so that its largest intensity is 1.
 */
public class ColumnNormalizer {

  /**
   * Divides every value in a column by that column's maximum.  A column whose maximum is zero comes back as all
   * zeros instead of NaN, which would otherwise poison contouring further down the line.
   * @param data A rectangular grid, rows = DT bins and columns = CV bins.  Not modified.
   * @return A new grid of the same shape.
   */
  public double[][] normalize(double[][] data) {
    Grids.checkRectangular(data);
    int rows = Grids.rows(data);
    int cols = Grids.cols(data);

    double[] colMax = new double[cols];
    for (int j = 0; j < cols; j++) {
      colMax[j] = -Double.MAX_VALUE;
      for (int i = 0; i < rows; i++) {
        colMax[j] = Math.max(colMax[j], data[i][j]);
      }
    }

    double[][] out = new double[rows][cols];
    for (int j = 0; j < cols; j++) {
      if (colMax[j] == 0.0) {
        // Leave the column zeroed.
        continue;
      }
      for (int i = 0; i < rows; i++) {
        out[i][j] = data[i][j] / colMax[j];
      }
    }
    return out;
  }
}
