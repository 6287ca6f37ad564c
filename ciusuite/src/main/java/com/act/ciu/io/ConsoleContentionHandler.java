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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Asks the person at the terminal to close a locked output file, then retries once they press enter.
 */
public class ConsoleContentionHandler implements WriteContentionHandler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConsoleContentionHandler.class);

  private final BufferedReader in;
  private final PrintStream out;

  public ConsoleContentionHandler() {
    this(System.in, System.out);
  }

  public ConsoleContentionHandler(InputStream in, PrintStream out) {
    this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    this.out = out;
  }

  @Override
  public boolean awaitRelease(File target, IOException cause) {
    LOGGER.warn("Unable to write %s: %s", target, cause.getMessage());
    out.format("The file %s is being used by another process. Close it, then press enter to retry saving.%n",
        target.getAbsolutePath());
    out.flush();
    try {
      // End of input means nobody is there to close the file.
      return in.readLine() != null;
    } catch (IOException e) {
      LOGGER.error("Unable to read a response from the console: %s", e.getMessage());
      return false;
    }
  }
}
