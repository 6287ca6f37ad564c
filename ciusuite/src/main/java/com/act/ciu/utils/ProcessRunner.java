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

package com.act.ciu.utils;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs gnuplot as a child process and logs what it prints.
 */
public class ProcessRunner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ProcessRunner.class);

  /**
   * Runs a child process and kills it if it has not exited after timeoutInSeconds.
   * @param command The executable; never a shell string.
   * @param args Its arguments.
   * @param timeoutInSeconds How long to wait for the process to exit.
   * @return The exit code of the child process, or -1 if it was killed for running too long.
   * @throws IOException if the executable cannot be started.
   */
  public int runProcess(String command, List<String> args, long timeoutInSeconds)
      throws InterruptedException, IOException {
    List<String> commandLine = new ArrayList<>(args.size() + 1);
    commandLine.add(command);
    commandLine.addAll(args);
    LOGGER.info("Running child process: %s", StringUtils.join(commandLine, " "));

    Process p = new ProcessBuilder(commandLine).start();
    drain(p.getInputStream(), l -> LOGGER.info("[%s STDOUT]: %s", command, l));
    drain(p.getErrorStream(), l -> LOGGER.warn("[%s STDERR]: %s", command, l));

    if (!p.waitFor(timeoutInSeconds, TimeUnit.SECONDS)) {
      LOGGER.error("%s did not finish within %d seconds, killing it", command, timeoutInSeconds);
      p.destroyForcibly();
      return -1;
    }
    if (p.exitValue() != 0) {
      LOGGER.error("%s exited with status %d", command, p.exitValue());
    }
    return p.exitValue();
  }

  private static void drain(InputStream stream, Consumer<String> lineConsumer) throws IOException {
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineConsumer.accept(line);
      }
    }
  }
}
