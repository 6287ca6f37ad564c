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
import org.apache.commons.math3.stat.StatUtils;

/**
 * Lookups and constructions over DT/CV axes.  Axes are assumed strictly monotonic; {@link #checkInterpolatable} is
 * the only place that verifies it, since only interpolation depends on it.
 */
public class AxisUtils {

  private AxisUtils() {
  }

  /**
   * Finds the index of the axis value closest to a target.  Targets beyond either end of the axis resolve to that
   * end's index, so out-of-range requests clamp rather than fail.
   * @param axis The axis to search.
   * @param value The value to look for.
   * @return The index minimizing |axis[i] - value|; the lowest such index on exact ties.
   */
  public static int nearestIndex(double[] axis, double value) {
    if (axis.length == 0) {
      throw new IllegalArgumentException("Cannot search an empty axis");
    }
    int best = 0;
    double bestDistance = Math.abs(axis[0] - value);
    for (int i = 1; i < axis.length; i++) {
      double distance = Math.abs(axis[i] - value);
      // Strict comparison keeps the first of several equally close values.
      if (distance < bestDistance) {
        best = i;
        bestDistance = distance;
      }
    }
    return best;
  }

  /**
   * @return numPoints evenly spaced values from start to end inclusive.  The last value is exactly end.
   */
  public static double[] linspace(double start, double end, int numPoints) {
    if (numPoints < 1) {
      throw new IllegalArgumentException(String.format("Cannot build an axis of %d points", numPoints));
    }
    double[] out = new double[numPoints];
    if (numPoints == 1) {
      out[0] = start;
      return out;
    }
    double step = (end - start) / (numPoints - 1);
    for (int i = 0; i < numPoints; i++) {
      out[i] = start + i * step;
    }
    out[numPoints - 1] = end;
    return out;
  }

  /**
   * Builds an axis that covers both input axes, from the smallest value in either to the largest in either.
   * @param axis1 The first axis.
   * @param axis2 The second axis.
   * @param numBins The number of points on the new axis.
   * @return An evenly spaced axis spanning the union of both ranges.
   */
  public static double[] unionAxis(double[] axis1, double[] axis2, int numBins) {
    double min = Math.min(StatUtils.min(axis1), StatUtils.min(axis2));
    double max = Math.max(StatUtils.max(axis1), StatUtils.max(axis2));
    return linspace(min, max, numBins);
  }

  public static boolean isStrictlyIncreasing(double[] axis) {
    for (int i = 1; i < axis.length; i++) {
      if (!(axis[i] > axis[i - 1])) {
        return false;
      }
    }
    return true;
  }

  public static boolean isStrictlyDecreasing(double[] axis) {
    for (int i = 1; i < axis.length; i++) {
      if (!(axis[i] < axis[i - 1])) {
        return false;
      }
    }
    return true;
  }

  /**
   * Rejects axes that cannot serve as interpolation knots.
   * @param axis The axis to check.
   * @param name A label for error messages, like "CV".
   * @throws ConfigurationException if the axis has fewer than two points or is not strictly monotonic.
   */
  public static void checkInterpolatable(double[] axis, String name) throws ConfigurationException {
    if (axis.length < 2) {
      throw new ConfigurationException(String.format(
          "The %s axis has %d point(s); at least two are needed to interpolate", name, axis.length));
    }
    if (!isStrictlyIncreasing(axis) && !isStrictlyDecreasing(axis)) {
      throw new ConfigurationException(String.format("The %s axis is not strictly monotonic", name));
    }
  }

  /**
   * @return The index of the largest value, the first one if several are equal.
   */
  public static int argMax(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("Cannot take the maximum of no values");
    }
    int best = 0;
    for (int i = 1; i < values.length; i++) {
      if (values[i] > values[best]) {
        best = i;
      }
    }
    return best;
  }

  public static double[] reversed(double[] values) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = values[values.length - 1 - i];
    }
    return out;
  }

  /**
   * @return True if both axes hold the same values to within the given absolute tolerance.
   */
  public static boolean sameValues(double[] axis1, double[] axis2, double tolerance) {
    if (axis1.length != axis2.length) {
      return false;
    }
    for (int i = 0; i < axis1.length; i++) {
      if (Math.abs(axis1[i] - axis2[i]) > tolerance) {
        return false;
      }
    }
    return true;
  }
}
