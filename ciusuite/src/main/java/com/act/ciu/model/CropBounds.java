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

import java.util.List;

/**
 * Axis values to crop a fingerprint to, in axis units.  Equal low/high values on an axis leave that axis uncropped.
 */
public class CropBounds {
  public static final int NUM_CROP_VALUES = 4;

  private final double cvLow;
  private final double cvHigh;
  private final double dtLow;
  private final double dtHigh;

  public CropBounds(double cvLow, double cvHigh, double dtLow, double dtHigh) {
    this.cvLow = cvLow;
    this.cvHigh = cvHigh;
    this.dtLow = dtLow;
    this.dtHigh = dtHigh;
  }

  /**
   * Builds bounds from the cropping_window_values parameter.
   * @param values Exactly four values, ordered [cv_low, cv_high, dt_low, dt_high].
   * @return The corresponding bounds.
   * @throws ConfigurationException if the list does not hold exactly four non-null values.
   */
  public static CropBounds fromValues(List<Double> values) throws ConfigurationException {
    if (values == null || values.size() != NUM_CROP_VALUES) {
      throw new ConfigurationException(String.format(
          "Crop values must be [cv_low, cv_high, dt_low, dt_high], but got %s", values));
    }
    for (Double v : values) {
      if (v == null || v.isNaN()) {
        throw new ConfigurationException(String.format("Crop values must all be numbers, but got %s", values));
      }
    }
    return new CropBounds(values.get(0), values.get(1), values.get(2), values.get(3));
  }

  public double getCvLow() {
    return cvLow;
  }

  public double getCvHigh() {
    return cvHigh;
  }

  public double getDtLow() {
    return dtLow;
  }

  public double getDtHigh() {
    return dtHigh;
  }

  @Override
  public String toString() {
    return String.format("CropBounds{cv=[%.3f, %.3f], dt=[%.3f, %.3f]}", cvLow, cvHigh, dtLow, dtHigh);
  }
}
