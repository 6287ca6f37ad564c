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

/**
 * The intensities of a CIU fingerprint exactly as read from disk, along with the axes from its header row/column and
 * the file it came from.  Instances are never modified after construction.
 */
public class CIURawMatrix implements Serializable {
  private static final long serialVersionUID = -2287105334711239407L;

  private static final String RAW_FILE_SUFFIX = "_raw.csv";

  @JsonProperty("filename")
  private String filename;

  @JsonProperty("filepath")
  private String filepath;

  @JsonProperty("raw_data")
  private double[][] rawData;

  @JsonProperty("axes")
  private CIUAxes axes;

  @JsonCreator
  public CIURawMatrix(@JsonProperty("filename") String filename,
                      @JsonProperty("filepath") String filepath,
                      @JsonProperty("raw_data") double[][] rawData,
                      @JsonProperty("axes") CIUAxes axes) {
    Grids.checkRectangular(rawData);
    Grids.checkMatchesAxes(rawData, axes);
    this.filename = filename;
    this.filepath = filepath;
    this.rawData = Grids.copy(rawData);
    this.axes = axes;
  }

  public String getFilename() {
    return filename;
  }

  public String getFilepath() {
    return filepath;
  }

  public double[][] getRawData() {
    return Grids.copy(rawData);
  }

  public CIUAxes getAxes() {
    return axes;
  }

  /**
   * @return The file name with any trailing _raw.csv removed, used to name everything derived from this file.
   */
  @JsonIgnore
  public String getShortName() {
    if (filename.endsWith(RAW_FILE_SUFFIX)) {
      return filename.substring(0, filename.length() - RAW_FILE_SUFFIX.length());
    }
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  @Override
  public String toString() {
    return String.format("CIURawMatrix{%s, %s}", filename, axes);
  }
}
