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

package com.act.ciu.model;

import com.act.ciu.ShapeMismatchException;

/**
 * Small helpers for the rectangular double[row][col] arrays that carry CIU intensities.  Rows are drift time bins,
 * columns are collision voltage bins.
 */
public class Grids {

  private Grids() {
  }

  public static int rows(double[][] grid) {
    return grid.length;
  }

  public static int cols(double[][] grid) {
    return grid.length == 0 ? 0 : grid[0].length;
  }

  public static double[][] copy(double[][] grid) {
    double[][] out = new double[grid.length][];
    for (int i = 0; i < grid.length; i++) {
      out[i] = grid[i].clone();
    }
    return out;
  }

  /**
   * Verifies every row has the same length.
   * @param grid The grid to check.
   * @throws ShapeMismatchException if the grid is ragged.
   */
  public static void checkRectangular(double[][] grid) {
    int cols = cols(grid);
    for (int i = 0; i < grid.length; i++) {
      if (grid[i] == null || grid[i].length != cols) {
        throw new ShapeMismatchException(String.format("Row %d of grid has %d columns, expected %d",
            i, grid[i] == null ? 0 : grid[i].length, cols));
      }
    }
  }

  public static void checkSameShape(String what, double[][] a, double[][] b) {
    if (rows(a) != rows(b) || cols(a) != cols(b)) {
      throw ShapeMismatchException.forShapes(what, rows(a), cols(a), rows(b), cols(b));
    }
  }

  public static void checkMatchesAxes(double[][] grid, CIUAxes axes) {
    if (rows(grid) != axes.getDtLength() || (rows(grid) > 0 && cols(grid) != axes.getCvLength())) {
      throw ShapeMismatchException.forShapes("Grid vs. (dt, cv) axes",
          rows(grid), cols(grid), axes.getDtLength(), axes.getCvLength());
    }
  }

  public static double max(double[][] grid) {
    double max = -Double.MAX_VALUE;
    for (double[] row : grid) {
      for (double v : row) {
        max = Math.max(max, v);
      }
    }
    return max;
  }

  public static double min(double[][] grid) {
    double min = Double.MAX_VALUE;
    for (double[] row : grid) {
      for (double v : row) {
        min = Math.min(min, v);
      }
    }
    return min;
  }

  public static double[] column(double[][] grid, int col) {
    double[] out = new double[grid.length];
    for (int i = 0; i < grid.length; i++) {
      out[i] = grid[i][col];
    }
    return out;
  }
}
