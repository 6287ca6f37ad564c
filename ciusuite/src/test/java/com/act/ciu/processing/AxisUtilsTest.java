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
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AxisUtilsTest {

  @Test
  public void testNearestIndexPicksClosestValue() {
    double[] axis = new double[]{0.0, 1.0, 2.0, 3.0};
    assertEquals("1.4 is closest to 1.0", 1, AxisUtils.nearestIndex(axis, 1.4));
    assertEquals("2.6 is closest to 3.0", 3, AxisUtils.nearestIndex(axis, 2.6));
    assertEquals("Exact ties resolve to the lower index", 1, AxisUtils.nearestIndex(axis, 1.5));
  }

  @Test
  public void testNearestIndexClampsOutOfRange() {
    double[] axis = new double[]{5.0, 10.0, 15.0};
    assertEquals(0, AxisUtils.nearestIndex(axis, -100.0));
    assertEquals(2, AxisUtils.nearestIndex(axis, 100.0));
  }

  @Test
  public void testNearestIndexOnDescendingAxis() {
    double[] axis = new double[]{30.0, 20.0, 10.0};
    assertEquals(2, AxisUtils.nearestIndex(axis, 11.0));
  }

  @Test
  public void testLinspace() {
    assertArrayEquals(new double[]{0.0, 0.25, 0.5, 0.75, 1.0}, AxisUtils.linspace(0.0, 1.0, 5), 1e-12);
    assertArrayEquals(new double[]{2.0, 1.0, 0.0}, AxisUtils.linspace(2.0, 0.0, 3), 1e-12);
    assertArrayEquals(new double[]{4.0}, AxisUtils.linspace(4.0, 9.0, 1), 0.0);
  }

  @Test
  public void testLinspaceEndsExactlyOnEnd() {
    double[] axis = AxisUtils.linspace(0.1, 0.7, 7);
    assertEquals("Last point must be the end value itself", 0.7, axis[6], 0.0);
    assertEquals(0.1, axis[0], 0.0);
  }

  @Test
  public void testUnionAxisSpansBothRanges() {
    double[] union = AxisUtils.unionAxis(new double[]{1.0, 2.0, 3.0}, new double[]{0.0, 5.0}, 6);
    assertArrayEquals(new double[]{0.0, 1.0, 2.0, 3.0, 4.0, 5.0}, union, 1e-12);
  }

  @Test
  public void testMonotonicity() {
    assertTrue(AxisUtils.isStrictlyIncreasing(new double[]{1.0, 2.0, 3.0}));
    assertFalse(AxisUtils.isStrictlyIncreasing(new double[]{1.0, 1.0, 3.0}));
    assertTrue(AxisUtils.isStrictlyDecreasing(new double[]{3.0, 2.0, 1.0}));
    assertFalse(AxisUtils.isStrictlyDecreasing(new double[]{3.0, 4.0}));
  }

  @Test
  public void testCheckInterpolatableAcceptsMonotonicAxes() throws Exception {
    AxisUtils.checkInterpolatable(new double[]{1.0, 2.0}, "CV");
    AxisUtils.checkInterpolatable(new double[]{9.0, 5.0, 1.0}, "DT");
  }

  @Test(expected = ConfigurationException.class)
  public void testCheckInterpolatableRejectsSinglePoint() throws Exception {
    AxisUtils.checkInterpolatable(new double[]{1.0}, "CV");
  }

  @Test(expected = ConfigurationException.class)
  public void testCheckInterpolatableRejectsNonMonotonicAxis() throws Exception {
    AxisUtils.checkInterpolatable(new double[]{1.0, 3.0, 2.0}, "CV");
  }

  @Test
  public void testArgMaxTakesFirstOfEqualMaxima() {
    assertEquals(1, AxisUtils.argMax(new double[]{1.0, 3.0, 3.0, 2.0}));
  }

  @Test
  public void testSameValues() {
    assertTrue(AxisUtils.sameValues(new double[]{1.0, 2.0}, new double[]{1.0, 2.0 + 1e-9}, 1e-6));
    assertFalse(AxisUtils.sameValues(new double[]{1.0, 2.0}, new double[]{1.0, 2.1}, 1e-6));
    assertFalse(AxisUtils.sameValues(new double[]{1.0, 2.0}, new double[]{1.0}, 1e-6));
  }
}
