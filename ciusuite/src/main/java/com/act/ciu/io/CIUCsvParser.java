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

package com.act.ciu.io;

import com.act.ciu.MissingInputException;
import com.act.ciu.model.CIUAxes;
import com.act.ciu.model.CIURawMatrix;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads _raw.csv CIU files: the first row holds the CV axis (after an empty corner cell), the first column the DT
 * axis, and the rest is intensities.  Empty cells read as zero.
 */
public class CIUCsvParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CIUCsvParser.class);

  public static final CSVFormat CIU_CSV_FORMAT = CSVFormat.DEFAULT.withIgnoreEmptyLines(true).withTrim(true);

  public CIURawMatrix parse(File file) throws MissingInputException {
    if (!file.isFile()) {
      throw new MissingInputException(file, String.format("Raw file %s does not exist", file.getAbsolutePath()));
    }

    List<CSVRecord> records;
    try (CSVParser parser = new CSVParser(
        new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8), CIU_CSV_FORMAT)) {
      records = parser.getRecords();
    } catch (IOException e) {
      throw new MissingInputException(file, String.format("Unable to read %s: %s", file, e.getMessage()), e);
    }

    if (records.size() < 2) {
      throw new MissingInputException(file, String.format("%s has no intensity rows", file));
    }

    CSVRecord header = records.get(0);
    int numCols = header.size() - 1;
    if (numCols < 1) {
      throw new MissingInputException(file, String.format("%s has no collision voltage columns", file));
    }
    double[] cvAxis = new double[numCols];
    for (int j = 0; j < numCols; j++) {
      cvAxis[j] = parseCell(file, header, j + 1);
    }

    int numRows = records.size() - 1;
    double[] dtAxis = new double[numRows];
    double[][] data = new double[numRows][numCols];
    for (int i = 0; i < numRows; i++) {
      CSVRecord record = records.get(i + 1);
      if (record.size() != numCols + 1) {
        throw new MissingInputException(file, String.format("Line %d of %s has %d cells, expected %d",
            record.getRecordNumber(), file, record.size(), numCols + 1));
      }
      dtAxis[i] = parseCell(file, record, 0);
      for (int j = 0; j < numCols; j++) {
        data[i][j] = parseCell(file, record, j + 1);
      }
    }

    LOGGER.info("Read %s: %d DT x %d CV bins", file.getName(), numRows, numCols);
    return new CIURawMatrix(file.getName(), file.getAbsolutePath(), data, new CIUAxes(dtAxis, cvAxis));
  }

  private static double parseCell(File file, CSVRecord record, int index) throws MissingInputException {
    String cell = record.get(index);
    if (cell.isEmpty()) {
      return 0.0;
    }
    try {
      return Double.parseDouble(cell);
    } catch (NumberFormatException e) {
      throw new MissingInputException(file, String.format("Line %d of %s: '%s' is not a number",
          record.getRecordNumber(), file, cell), e);
    }
  }
}
