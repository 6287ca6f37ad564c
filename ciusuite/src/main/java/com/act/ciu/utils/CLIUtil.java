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

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared option handling for the command line tools: adds --help, prints usage on bad arguments and exits.
 */
public class CLIUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CLIUtil.class);

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();
  static {
    HELP_FORMATTER.setWidth(100);
  }

  private final Class<?> callingClass;
  private final String helpMessage;
  private final Options opts;
  private CommandLine commandLine;

  public CLIUtil(Class<?> callingClass, String helpMessage, List<Option.Builder> optionBuilders) {
    this.callingClass = callingClass;
    this.helpMessage = helpMessage;

    List<Option.Builder> options = new ArrayList<>(optionBuilders);
    options.add(Option.builder("h")
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );

    opts = new Options();
    for (Option.Builder b : options) {
      opts.addOption(b.build());
    }
  }

  /**
   * Parses arguments without exiting; callers that want the usual print-usage-and-exit behavior use
   * {@link #parseCommandLine(String[])}.
   */
  public CommandLine parse(String[] args) throws ParseException {
    CommandLineParser parser = new DefaultParser();
    commandLine = parser.parse(opts, args);
    return commandLine;
  }

  public CommandLine parseCommandLine(String[] args) {
    CommandLine cl = null;
    try {
      cl = parse(args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s\n", e.getMessage());
      printHelp();
      System.exit(1);
    }

    if (cl.hasOption("help")) {
      printHelp();
      System.exit(0);
    }

    return cl;
  }

  public CommandLine getCommandLine() {
    return this.commandLine;
  }

  public Options getOptions() {
    return opts;
  }

  /**
   * @return The directory named by an option, created if needed, or the default when the option is absent.
   */
  public File getOutputDirectory(String option, File defaultDir) {
    if (commandLine == null || !commandLine.hasOption(option)) {
      return defaultDir;
    }
    File dir = new File(commandLine.getOptionValue(option));
    if (!dir.exists() && !dir.mkdirs()) {
      failWithMessage("Unable to create output directory %s", dir.getAbsolutePath());
    }
    if (!dir.isDirectory()) {
      failWithMessage("Output path %s is not a directory", dir.getAbsolutePath());
    }
    return dir;
  }

  public void printHelp() {
    HELP_FORMATTER.printHelp(callingClass.getCanonicalName(), helpMessage, opts, null, true);
  }

  public void failWithMessage(String formatStr, String... args) {
    failWithMessage(String.format(formatStr, (Object[]) args));
  }

  public void failWithMessage(String msg) {
    System.out.println(msg);
    printHelp();
    System.exit(1);
  }
}
