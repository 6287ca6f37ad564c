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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Arrays;

/**
 * The drift time (row) and collision voltage (column) axes of a CIU fingerprint.  Both arrays are copied on the way
 * in and on the way out, so an instance can be shared freely between grids.
 */
public class CIUAxes implements Serializable {
  private static final long serialVersionUID = 4172036614780532651L;

  @JsonProperty("dt_axis")
  private double[] dtAxis;

  @JsonProperty("cv_axis")
  private double[] cvAxis;

  @JsonCreator
  public CIUAxes(@JsonProperty("dt_axis") double[] dtAxis, @JsonProperty("cv_axis") double[] cvAxis) {
    if (dtAxis == null || cvAxis == null) {
      throw new IllegalArgumentException("Both the DT and CV axes must be specified");
    }
    this.dtAxis = Arrays.copyOf(dtAxis, dtAxis.length);
    this.cvAxis = Arrays.copyOf(cvAxis, cvAxis.length);
  }

  public double[] getDtAxis() {
    return Arrays.copyOf(dtAxis, dtAxis.length);
  }

  public double[] getCvAxis() {
    return Arrays.copyOf(cvAxis, cvAxis.length);
  }

  @JsonIgnore
  public int getDtLength() {
    return dtAxis.length;
  }

  @JsonIgnore
  public int getCvLength() {
    return cvAxis.length;
  }

  public CIUAxes withDtAxis(double[] newDtAxis) {
    return new CIUAxes(newDtAxis, cvAxis);
  }

  public CIUAxes withCvAxis(double[] newCvAxis) {
    return new CIUAxes(dtAxis, newCvAxis);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    CIUAxes that = (CIUAxes) o;
    return Arrays.equals(dtAxis, that.dtAxis) && Arrays.equals(cvAxis, that.cvAxis);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(dtAxis) + Arrays.hashCode(cvAxis);
  }

  @Override
  public String toString() {
    return String.format("CIUAxes{dt=%d bins, cv=%d bins}", dtAxis.length, cvAxis.length);
  }
}
