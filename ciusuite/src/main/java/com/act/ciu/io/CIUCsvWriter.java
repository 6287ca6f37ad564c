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

import com.act.ciu.model.CIUAxes;
import com.act.ciu.model.Grids;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes CIU grids in the same _raw.csv layout {@link CIUCsvParser} reads.
 */
public class CIUCsvWriter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CIUCsvWriter.class);

  public static final CSVFormat CIU_CSV_FORMAT = CSVFormat.DEFAULT.withRecordSeparator('\n');

  private final WriteContentionHandler contentionHandler;

  public CIUCsvWriter() {
    this(WriteContentionHandler.FAIL_FAST);
  }

  public CIUCsvWriter(WriteContentionHandler contentionHandler) {
    this.contentionHandler = contentionHandler;
  }

  /**
   * Writes a grid whose axes are held separately: a header row of CV values behind an empty corner cell, then one row
   * per DT bin starting with its DT value.
   */
  public void write(File target, double[][] data, CIUAxes axes) throws IOException {
    Grids.checkMatchesAxes(data, axes);
    double[] dt = axes.getDtAxis();
    double[] cv = axes.getCvAxis();

    List<List<Object>> rows = new ArrayList<>(dt.length + 1);
    List<Object> header = new ArrayList<>(cv.length + 1);
    // Null prints as a bare empty cell; an empty string in the first column would be quoted.
    header.add(null);
    for (double c : cv) {
      header.add(c);
    }
    rows.add(header);
    for (int i = 0; i < dt.length; i++) {
      List<Object> row = new ArrayList<>(cv.length + 1);
      row.add(dt[i]);
      for (double v : data[i]) {
        row.add(v);
      }
      rows.add(row);
    }
    writeRows(target, rows);
  }

  /**
   * Writes a matrix that already carries its axes in its first row and column, row for row.
   */
  public void writeWithEmbeddedAxes(File target, double[][] dataWithAxes) throws IOException {
    List<List<Object>> rows = new ArrayList<>(dataWithAxes.length);
    for (double[] r : dataWithAxes) {
      List<Object> row = new ArrayList<>(r.length);
      for (double v : r) {
        row.add(v);
      }
      rows.add(row);
    }
    writeRows(target, rows);
  }

  private void writeRows(File target, List<List<Object>> rows) throws IOException {
    try {
      doWrite(target, rows);
    } catch (FileSystemException e) {
      if (!contentionHandler.awaitRelease(target, e)) {
        throw new WriteContentionException(target, e);
      }
      LOGGER.info("Retrying write to %s", target);
      try {
        doWrite(target, rows);
      } catch (FileSystemException retryFailure) {
        throw new WriteContentionException(target, retryFailure);
      }
    }
    LOGGER.info("Wrote %s", target.getAbsolutePath());
  }

  private void doWrite(File target, List<List<Object>> rows) throws IOException {
    try (Writer writer = Files.newBufferedWriter(target.toPath(), StandardCharsets.UTF_8);
         CSVPrinter printer = new CSVPrinter(writer, CIU_CSV_FORMAT)) {
      printer.printRecords(rows);
      printer.flush();
    }
  }
}
