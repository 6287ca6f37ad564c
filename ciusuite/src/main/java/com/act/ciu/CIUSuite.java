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

package com.act.ciu;

import com.act.ciu.analysis.FingerprintComparator;
import com.act.ciu.analysis.FingerprintComparator.ComparisonResult;
import com.act.ciu.analysis.ReplicateAverager;
import com.act.ciu.analysis.ReplicateAverager.AveragedFingerprint;
import com.act.ciu.io.AnalysisGridSerializer;
import com.act.ciu.io.CIUCsvParser;
import com.act.ciu.io.CIUCsvWriter;
import com.act.ciu.io.CIUParametersParser;
import com.act.ciu.io.ConsoleContentionHandler;
import com.act.ciu.model.CIUAnalysisGrid;
import com.act.ciu.model.CIUParameters;
import com.act.ciu.plotter.CIUGnuplotter;
import com.act.ciu.plotter.ContourLevelGenerator;
import com.act.ciu.processing.DeltaDriftTime;
import com.act.ciu.processing.RawProcessingPipeline;
import com.act.ciu.utils.CLIUtil;
import com.act.ciu.utils.ProcessRunner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line front end: processes raw CIU files into fingerprints, compares two fingerprints, or averages replicate
 * fingerprints.  Inputs may be raw _raw.csv files (processed with the given parameters) or previously saved
 * .ciu.json analyses.
 */
public class CIUSuite {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CIUSuite.class);

  public static final String OPTION_MODE = "m";
  public static final String OPTION_INPUTS = "i";
  public static final String OPTION_PARAMETERS = "p";
  public static final String OPTION_OUTPUT_DIR = "o";
  public static final String OPTION_DELTA_DT = "d";
  public static final String OPTION_STRICT_PARAMETERS = "s";
  public static final String OPTION_NO_PLOTS = "n";
  public static final String OPTION_GNUPLOT = "g";

  public static final String MODE_PROCESS = "process";
  public static final String MODE_COMPARE = "compare";
  public static final String MODE_AVERAGE = "average";

  public static final String PROCESSED_CSV_SUFFIX = "_processed_raw.csv";
  public static final String AVERAGE_SUFFIX = "_avg";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Processes collision induced unfolding (CIU) data.  In 'process' mode every input is normalized, smoothed, ",
      "interpolated and cropped as the parameter file says, then saved and plotted.  'compare' reports the RMSD ",
      "between two fingerprints and plots their difference.  'average' combines replicates into a mean fingerprint ",
      "and a standard deviation map."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_MODE)
        .argName("mode")
        .desc(String.format("What to do: %s, %s or %s", MODE_PROCESS, MODE_COMPARE, MODE_AVERAGE))
        .hasArg().required()
        .longOpt("mode")
    );
    add(Option.builder(OPTION_INPUTS)
        .argName("input files")
        .desc("Raw CIU csv files or saved .ciu.json analyses")
        .hasArgs().valueSeparator(',').required()
        .longOpt("inputs")
    );
    add(Option.builder(OPTION_PARAMETERS)
        .argName("parameter file")
        .desc("A parameter file; without one raw inputs are only normalized")
        .hasArg()
        .longOpt("params")
    );
    add(Option.builder(OPTION_OUTPUT_DIR)
        .argName("output dir")
        .desc("Where to write analyses, csv files and plots (default: the working directory)")
        .hasArg()
        .longOpt("output-dir")
    );
    add(Option.builder(OPTION_DELTA_DT)
        .argName("delta dt")
        .desc("Shift drift times so the first CV column peaks at zero before comparing or averaging")
        .longOpt("delta-dt")
    );
    add(Option.builder(OPTION_STRICT_PARAMETERS)
        .argName("strict")
        .desc("Fail on unrecognized parameter names instead of ignoring them")
        .longOpt("strict-params")
    );
    add(Option.builder(OPTION_NO_PLOTS)
        .argName("no plots")
        .desc("Skip plotting")
        .longOpt("no-plots")
    );
    add(Option.builder(OPTION_GNUPLOT)
        .argName("gnuplot")
        .desc(String.format("The gnuplot executable to run (default: %s)", CIUGnuplotter.DEFAULT_GNUPLOT))
        .hasArg()
        .longOpt("gnuplot")
    );
  }};

  private final CIUCsvParser csvParser;
  private final CIUCsvWriter csvWriter;
  private final AnalysisGridSerializer serializer;
  private final RawProcessingPipeline pipeline;
  private final FingerprintComparator comparator;
  private final ReplicateAverager averager;
  private final DeltaDriftTime deltaDriftTime;
  private final ContourLevelGenerator levelGenerator;
  // Null when plotting is off.
  private final CIUGnuplotter plotter;

  public CIUSuite(CIUCsvParser csvParser, CIUCsvWriter csvWriter, AnalysisGridSerializer serializer,
                  RawProcessingPipeline pipeline, FingerprintComparator comparator, ReplicateAverager averager,
                  DeltaDriftTime deltaDriftTime, ContourLevelGenerator levelGenerator, CIUGnuplotter plotter) {
    this.csvParser = csvParser;
    this.csvWriter = csvWriter;
    this.serializer = serializer;
    this.pipeline = pipeline;
    this.comparator = comparator;
    this.averager = averager;
    this.deltaDriftTime = deltaDriftTime;
    this.levelGenerator = levelGenerator;
    this.plotter = plotter;
  }

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(CIUSuite.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    String mode = cl.getOptionValue(OPTION_MODE);
    List<File> inputs = new ArrayList<>();
    for (String path : cl.getOptionValues(OPTION_INPUTS)) {
      inputs.add(new File(path));
    }

    CIUParameters params = new CIUParameters();
    if (cl.hasOption(OPTION_PARAMETERS)) {
      File paramFile = new File(cl.getOptionValue(OPTION_PARAMETERS));
      if (!paramFile.isFile()) {
        cliUtil.failWithMessage("Parameter file does not exist at %s", paramFile.getAbsolutePath());
      }
      params = new CIUParametersParser(cl.hasOption(OPTION_STRICT_PARAMETERS)).parse(paramFile);
    }

    File outputDir = cliUtil.getOutputDirectory(OPTION_OUTPUT_DIR, new File(System.getProperty("user.dir")));
    boolean applyDeltaDt = cl.hasOption(OPTION_DELTA_DT);

    CIUGnuplotter plotter = cl.hasOption(OPTION_NO_PLOTS) ? null :
        new CIUGnuplotter(new ProcessRunner(), cl.getOptionValue(OPTION_GNUPLOT, CIUGnuplotter.DEFAULT_GNUPLOT));
    CIUSuite suite = new CIUSuite(new CIUCsvParser(), new CIUCsvWriter(new ConsoleContentionHandler()),
        new AnalysisGridSerializer(), new RawProcessingPipeline(), new FingerprintComparator(),
        new ReplicateAverager(), new DeltaDriftTime(), new ContourLevelGenerator(), plotter);

    switch (mode) {
      case MODE_PROCESS:
        List<CIUAnalysisGrid> processed = suite.processAll(inputs, params, outputDir);
        if (processed.size() < inputs.size()) {
          LOGGER.error("%d of %d inputs failed", inputs.size() - processed.size(), inputs.size());
          System.exit(1);
        }
        break;
      case MODE_COMPARE:
        if (inputs.size() != 2) {
          cliUtil.failWithMessage("Comparison needs exactly two inputs, got %s", String.valueOf(inputs.size()));
        }
        ComparisonResult result = suite.compare(inputs.get(0), inputs.get(1), params, applyDeltaDt, outputDir);
        System.out.format("RMSD %s vs %s: %.4f\n", inputs.get(0).getName(), inputs.get(1).getName(),
            result.getRmsd());
        break;
      case MODE_AVERAGE:
        if (inputs.isEmpty()) {
          cliUtil.failWithMessage("Averaging needs at least one input");
        }
        suite.average(inputs, params, applyDeltaDt, outputDir);
        break;
      default:
        cliUtil.failWithMessage("Unknown mode '%s'", mode);
    }
  }

  /**
   * Loads an input as an analysis grid: saved analyses are read back as they are, raw files are processed with params.
   */
  public CIUAnalysisGrid load(File input, CIUParameters params) throws MissingInputException, ConfigurationException {
    if (AnalysisGridSerializer.isSerializedGrid(input)) {
      return serializer.read(input);
    }
    return pipeline.process(csvParser.parse(input), params);
  }

  /**
   * Processes each input, saving its analysis (and processed csv and fingerprint plot when enabled) to outputDir.
   * A failing input is logged and skipped.
   * @return The grids that were processed successfully, in input order.
   */
  public List<CIUAnalysisGrid> processAll(List<File> inputs, CIUParameters params, File outputDir) {
    List<CIUAnalysisGrid> results = new ArrayList<>(inputs.size());
    int i = 0;
    for (File input : inputs) {
      i++;
      LOGGER.info("Processing file %d of %d: %s", i, inputs.size(), input);
      try {
        CIUAnalysisGrid grid = load(input, params);
        serializer.write(grid, AnalysisGridSerializer.defaultOutputFile(grid, outputDir));
        if (CIUParameters.isSet(params.getOutput1SaveCsv())) {
          csvWriter.write(new File(outputDir, grid.getShortName() + PROCESSED_CSV_SUFFIX),
              grid.getData(), grid.getAxes());
        }
        if (plotter != null) {
          plotter.plotFingerprint(grid, levelGenerator.fingerprintLevels(grid.getData()), outputDir);
        }
        results.add(grid);
      } catch (MissingInputException | ConfigurationException | IOException | ShapeMismatchException e) {
        LOGGER.error("Unable to process %s: %s", input, e.getMessage());
      }
    }
    LOGGER.info("Processed %d of %d file(s)", results.size(), inputs.size());
    return results;
  }

  /**
   * Compares two inputs, writing the difference csv (when enabled) and the difference plot to outputDir.
   */
  public ComparisonResult compare(File first, File second, CIUParameters params, boolean applyDeltaDt,
                                  File outputDir) throws MissingInputException, ConfigurationException, IOException {
    CIUAnalysisGrid grid1 = prepare(load(first, params), applyDeltaDt);
    CIUAnalysisGrid grid2 = prepare(load(second, params), applyDeltaDt);
    ComparisonResult result = comparator.compare(grid1, grid2);
    LOGGER.info("RMSD between %s and %s: %.4f", grid1.getShortName(), grid2.getShortName(), result.getRmsd());

    String name1 = StringUtils.defaultIfBlank(params.getCompare1CustomRed(), grid1.getShortName());
    String name2 = StringUtils.defaultIfBlank(params.getCompare2CustomBlue(), grid2.getShortName());
    if (CIUParameters.isSet(params.getOutput1SaveCsv())) {
      csvWriter.write(new File(outputDir, String.format("%s-%s_raw.csv", name1, name2)),
          result.getDifference(), result.getAxes());
    }
    if (plotter != null) {
      plotter.plotDifference(result,
          levelGenerator.differenceLevels(result.getDifference(), CIUParameters.isSet(params.getCompare3HighContrast())),
          name1, name2, params, outputDir);
    }
    return result;
  }

  /**
   * Averages replicate inputs, saving the averaged analysis, the averaged csv (when enabled) and a standard deviation
   * plot to outputDir.  Inputs that cannot be loaded are left out of the average.
   */
  public AveragedFingerprint average(List<File> inputs, CIUParameters params, boolean applyDeltaDt, File outputDir)
      throws IOException, ConfigurationException {
    List<CIUAnalysisGrid> replicates = new ArrayList<>(inputs.size());
    for (File input : inputs) {
      try {
        replicates.add(prepare(load(input, params), applyDeltaDt));
      } catch (MissingInputException | ConfigurationException e) {
        LOGGER.error("Leaving %s out of the average: %s", input, e.getMessage());
      }
    }
    if (replicates.isEmpty()) {
      throw new ConfigurationException("None of the replicates could be loaded");
    }

    AveragedFingerprint averaged = averager.average(replicates);
    CIUAnalysisGrid avg = averaged.getAverage();
    String name = avg.getShortName() + AVERAGE_SUFFIX;
    serializer.write(avg, new File(outputDir, name + AnalysisGridSerializer.EXTENSION));
    if (CIUParameters.isSet(params.getOutput1SaveCsv())) {
      csvWriter.write(new File(outputDir, name + PROCESSED_CSV_SUFFIX), avg.getData(), avg.getAxes());
    }
    if (plotter != null) {
      double[][] stdDev = averaged.getStandardDeviation();
      plotter.plotStandardDeviation(avg, stdDev, levelGenerator.standardDeviationLevels(stdDev), outputDir);
    }
    return averaged;
  }

  private CIUAnalysisGrid prepare(CIUAnalysisGrid grid, boolean applyDeltaDt) {
    return applyDeltaDt ? deltaDriftTime.shift(grid) : grid;
  }
}
