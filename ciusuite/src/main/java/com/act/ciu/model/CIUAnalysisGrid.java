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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A processed CIU fingerprint: the working intensity grid, the axes that label it, the parameters that produced it and
 * the raw file(s) it was derived from.  The grid and its axes only ever change together, through
 * {@link #update(double[][], CIUAxes)} or {@link #withData(double[][], CIUAxes)}, so that the number of rows always
 * equals the DT axis length and the number of columns the CV axis length.
 *
 * A grid built by averaging replicates carries every replicate's raw matrix, in input order; the first one is
 * returned by {@link #getRaw()}.
 */
public class CIUAnalysisGrid implements Serializable {
  private static final long serialVersionUID = 7803553713932517712L;

  @JsonProperty("provenance")
  private List<CIURawMatrix> provenance;

  @JsonProperty("data")
  private double[][] data;

  @JsonProperty("axes")
  private CIUAxes axes;

  @JsonProperty("parameters")
  private CIUParameters parameters;

  public CIUAnalysisGrid(CIURawMatrix raw, double[][] data, CIUAxes axes, CIUParameters parameters) {
    this(Collections.singletonList(raw), data, axes, parameters);
  }

  @JsonCreator
  public CIUAnalysisGrid(@JsonProperty("provenance") List<CIURawMatrix> provenance,
                         @JsonProperty("data") double[][] data,
                         @JsonProperty("axes") CIUAxes axes,
                         @JsonProperty("parameters") CIUParameters parameters) {
    if (provenance == null || provenance.isEmpty()) {
      throw new IllegalArgumentException("An analysis grid must come from at least one raw matrix");
    }
    this.provenance = new ArrayList<>(provenance);
    this.parameters = parameters == null ? new CIUParameters() : parameters;
    update(data, axes);
  }

  /**
   * Replaces the grid and its axes in one step.
   * @param newData The new intensity grid; copied.
   * @param newAxes Axes whose lengths match the new grid's rows and columns.
   * @throws com.act.ciu.ShapeMismatchException if the grid is ragged or disagrees with the axes.
   */
  public void update(double[][] newData, CIUAxes newAxes) {
    Grids.checkRectangular(newData);
    Grids.checkMatchesAxes(newData, newAxes);
    this.data = Grids.copy(newData);
    this.axes = newAxes;
  }

  /**
   * @return A new grid with the same provenance and parameters as this one but the given data and axes.
   */
  public CIUAnalysisGrid withData(double[][] newData, CIUAxes newAxes) {
    return new CIUAnalysisGrid(provenance, newData, newAxes, parameters);
  }

  @JsonIgnore
  public CIURawMatrix getRaw() {
    return provenance.get(0);
  }

  public List<CIURawMatrix> getProvenance() {
    return Collections.unmodifiableList(provenance);
  }

  public double[][] getData() {
    return Grids.copy(data);
  }

  public CIUAxes getAxes() {
    return axes;
  }

  public CIUParameters getParameters() {
    return parameters;
  }

  @JsonIgnore
  public int getNumRows() {
    return Grids.rows(data);
  }

  @JsonIgnore
  public int getNumCols() {
    return Grids.cols(data);
  }

  @JsonIgnore
  public String getShortName() {
    return getRaw().getShortName();
  }

  @Override
  public String toString() {
    return String.format("CIUAnalysisGrid{%s, %d x %d, %d raw file(s)}",
        getShortName(), getNumRows(), getNumCols(), provenance.size());
  }
}
