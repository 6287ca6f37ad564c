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

import com.act.ciu.ConfigurationException;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;

public class CropBoundsTest {

  @Test
  public void testValuesAreCvThenDt() throws Exception {
    CropBounds bounds = CropBounds.fromValues(Arrays.asList(10.0, 50.0, 2.0, 8.0));
    assertEquals(10.0, bounds.getCvLow(), 0.0);
    assertEquals(50.0, bounds.getCvHigh(), 0.0);
    assertEquals(2.0, bounds.getDtLow(), 0.0);
    assertEquals(8.0, bounds.getDtHigh(), 0.0);
  }

  @Test(expected = ConfigurationException.class)
  public void testTooManyValues() throws Exception {
    CropBounds.fromValues(Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0));
  }

  @Test(expected = ConfigurationException.class)
  public void testNullValue() throws Exception {
    CropBounds.fromValues(Arrays.asList(1.0, null, 3.0, 4.0));
  }

  @Test(expected = ConfigurationException.class)
  public void testNoValues() throws Exception {
    CropBounds.fromValues(null);
  }
}
