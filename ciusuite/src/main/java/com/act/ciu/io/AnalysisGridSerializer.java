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
import com.act.ciu.model.CIUAnalysisGrid;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;

/**
 * Saves analysis grids, together with their axes, every raw file that went into them and the parameters they were
 * made with, so a later comparison or average can start from the processed grid instead of the raw data.
 */
public class AnalysisGridSerializer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AnalysisGridSerializer.class);

  public static final String EXTENSION = ".ciu.json";

  private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  /**
   * @return Where a grid is saved by default: next to its raw file, or in outputDir if one is given.
   */
  public static File defaultOutputFile(CIUAnalysisGrid grid, File outputDir) {
    File dir = outputDir;
    if (dir == null) {
      String rawPath = grid.getRaw().getFilepath();
      dir = rawPath == null ? null : new File(rawPath).getAbsoluteFile().getParentFile();
    }
    return new File(dir, grid.getShortName() + EXTENSION);
  }

  public static boolean isSerializedGrid(File file) {
    return file.getName().endsWith(EXTENSION);
  }

  public void write(CIUAnalysisGrid grid, File target) throws IOException {
    mapper.writeValue(target, grid);
    LOGGER.info("Saved %s to %s", grid.getShortName(), target.getAbsolutePath());
  }

  public CIUAnalysisGrid read(File source) throws MissingInputException {
    if (!source.isFile()) {
      throw new MissingInputException(source, String.format("Analysis file %s does not exist", source));
    }
    try {
      return mapper.readValue(source, CIUAnalysisGrid.class);
    } catch (IOException e) {
      throw new MissingInputException(source,
          String.format("Unable to read analysis file %s: %s", source, e.getMessage()), e);
    }
  }
}
