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
import org.junit.Test;

import static com.act.ciu.TestGrids.FP_TOLERANCE;
import static com.act.ciu.TestGrids.assertGridEquals;
import static com.act.ciu.TestGrids.grid;
import static org.junit.Assert.assertArrayEquals;

public class DeltaDriftTimeTest {

  @Test
  public void testShiftCentersFirstColumnPeakOnZero() {
    double[][] data = new double[][]{
        {0.1, 1.0},
        {0.5, 0.0},
        {1.0, 0.0},
        {0.2, 0.0},
    };
    CIUAnalysisGrid g = grid("shift", data, new double[]{1.0, 2.0, 3.0, 4.0}, new double[]{5.0, 10.0});

    CIUAnalysisGrid out = new DeltaDriftTime().shift(g);
    assertArrayEquals(new double[]{-2.0, -1.0, 0.0, 1.0}, out.getAxes().getDtAxis(), FP_TOLERANCE);
    assertArrayEquals(new double[]{5.0, 10.0}, out.getAxes().getCvAxis(), 0.0);
    assertGridEquals("Intensities are unchanged", data, out.getData(), 0.0);
    assertArrayEquals("Source axes untouched", new double[]{1.0, 2.0, 3.0, 4.0}, g.getAxes().getDtAxis(), 0.0);
  }
}
