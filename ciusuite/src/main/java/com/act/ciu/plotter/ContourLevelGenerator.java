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

package com.act.ciu.plotter;

import com.act.ciu.model.Grids;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Computes the contour levels fingerprints are drawn with.
 *
 * Levels are worked out in integer percent (intensity * 100) and converted back at the end.  The step between levels
 * is snapped to a power of ten so the bands fall on round values, and everything below the merge cutoff is folded
 * into one bottom band.
 */
public class ContourLevelGenerator {

  public static final double DEFAULT_MERGE_CUTOFF = 10.0;
  public static final int DEFAULT_NUM_CONTOURS = 100;

  // The fraction of the maximum standard deviation folded into the bottom band of a std dev plot.
  public static final double STD_DEV_MERGE_FRACTION = 0.05;

  public static final int NUM_DIFFERENCE_LEVELS = 50;
  public static final int NUM_DIFFERENCE_TICKS = 3;
  public static final int NUM_STD_DEV_TICKS = 6;

  private static final double[] POSSIBLE_STEPS = new double[]{0.001, 0.01, 0.1, 1, 10, 100};
  private static final List<Double> FINGERPRINT_TICKS = Arrays.asList(0.0, 0.25, 0.5, 0.75, 1.0);

  public ContourLevels fingerprintLevels(double[][] data) {
    return new ContourLevels(getContourLevels(data, DEFAULT_MERGE_CUTOFF, DEFAULT_NUM_CONTOURS), FINGERPRINT_TICKS);
  }

  /**
   * Computes contour levels for a grid.
   * @param data The grid to be drawn; must not be empty.
   * @param mergeCutoff Percent intensity below which all levels merge into one.
   * @param numContours The approximate number of levels wanted.
   * @return Ascending levels: the padded minimum first, then mergeCutoff, mergeCutoff + step, ... below the padded
   *         maximum, all divided by 100.
   */
  public List<Double> getContourLevels(double[][] data, double mergeCutoff, int numContours) {
    if (Grids.rows(data) == 0 || Grids.cols(data) == 0) {
      throw new IllegalArgumentException("Cannot compute contour levels for an empty grid");
    }
    if (numContours < 1) {
      throw new IllegalArgumentException(String.format("Need at least one contour, got %d", numContours));
    }

    // Pad by one percent each way so rounding never leaves cells outside every band.
    long maxVal = (long) Math.rint(Grids.max(data) * 100) + 1;
    long minVal = (long) Math.rint(Grids.min(data) * 100) - 1;
    double step = snapStep((maxVal - minVal) / (double) numContours);

    List<Double> levels = new ArrayList<>();
    levels.add((double) minVal);
    long numSteps = (long) Math.ceil((maxVal - mergeCutoff) / step);
    for (long i = 0; i < numSteps; i++) {
      double level = mergeCutoff + i * step;
      // When the data never reaches down to the cutoff there is nothing to merge.
      if (level > minVal) {
        levels.add(level);
      }
    }

    List<Double> scaled = new ArrayList<>(levels.size());
    for (Double level : levels) {
      scaled.add(level / 100.0);
    }
    return scaled;
  }

  /**
   * @return The candidate step closest to the raw step, the smaller one on a tie.
   */
  static double snapStep(double rawStep) {
    double best = POSSIBLE_STEPS[0];
    for (double candidate : POSSIBLE_STEPS) {
      if (Math.abs(candidate - rawStep) < Math.abs(best - rawStep)) {
        best = candidate;
      }
    }
    return best;
  }

  /**
   * Levels for an RMSD difference plot, evenly spaced and symmetric about zero.  In high contrast mode the scale
   * stops just past the largest difference (rounded to the hundredth, plus 0.01); otherwise it spans -1 to 1.
   * @param difference The difference grid.
   * @param highContrast Whether to scale to the data.
   * @return 50 levels and 3 ticks.
   */
  public ContourLevels differenceLevels(double[][] difference, boolean highContrast) {
    double scale = 1.0;
    if (highContrast) {
      double maxAbs = Math.max(Math.abs(Grids.max(difference)), Math.abs(Grids.min(difference)));
      scale = Math.rint(maxAbs * 100) / 100.0 + 0.01;
    }
    return new ContourLevels(linspace(-scale, scale, NUM_DIFFERENCE_LEVELS),
        linspace(-scale, scale, NUM_DIFFERENCE_TICKS));
  }

  /**
   * Levels for a replicate standard deviation plot; the lowest 5% of the maximum deviation is one band.
   */
  public ContourLevels standardDeviationLevels(double[][] stdDev) {
    double maxStdDev = Grids.max(stdDev);
    double cutoff = Math.rint(STD_DEV_MERGE_FRACTION * maxStdDev * 100);
    return new ContourLevels(getContourLevels(stdDev, cutoff, DEFAULT_NUM_CONTOURS),
        linspace(0.0, maxStdDev, NUM_STD_DEV_TICKS));
  }

  private static List<Double> linspace(double start, double end, int num) {
    List<Double> out = new ArrayList<>(num);
    for (int i = 0; i < num; i++) {
      out.add(i == num - 1 ? end : start + i * (end - start) / (num - 1));
    }
    return out;
  }
}
