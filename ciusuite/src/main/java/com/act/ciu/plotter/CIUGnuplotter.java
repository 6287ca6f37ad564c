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

package com.act.ciu.plotter;

import com.act.ciu.ConfigurationException;
import com.act.ciu.analysis.FingerprintComparator.ComparisonResult;
import com.act.ciu.model.CIUAnalysisGrid;
import com.act.ciu.model.CIUAxes;
import com.act.ciu.model.CIUParameters;
import com.act.ciu.model.Grids;
import com.act.ciu.utils.ProcessRunner;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Draws fingerprints, RMSD difference maps and replicate standard deviation maps with gnuplot.
 *
 * Each plot is a fresh gnuplot invocation built from its own arguments, so nothing carries over from one plot to the
 * next.  The grid is written next to the image as a gnuplot "nonuniform matrix" data file, with every cell already
 * snapped down to the contour level of the band it falls in; pm3d then fills the bands like a filled contour plot.
 */
public class CIUGnuplotter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CIUGnuplotter.class);

  public static final String DEFAULT_GNUPLOT = "gnuplot";
  public static final String DEFAULT_EXTENSION = ".png";
  public static final double DEFAULT_FIG_WIDTH = 6.4;
  public static final double DEFAULT_FIG_HEIGHT = 4.8;
  public static final int DEFAULT_DPI = 100;
  public static final int DEFAULT_FONT_SIZE = 12;
  public static final String DEFAULT_X_TITLE = "Collision Voltage (V)";
  public static final String DEFAULT_Y_TITLE = "Drift Time (ms)";
  public static final String DEFAULT_CMAP = "viridis";
  public static final String DIFFERENCE_CMAP = "bwr";
  public static final String DATA_FILE_SUFFIX = ".gnuplot.dat";

  private static final long GNUPLOT_TIMEOUT_IN_SECONDS = 120L;
  private static final double MIN_COLOR_RANGE = 0.01;

  private static final Map<String, String> PALETTES = new HashMap<String, String>() {{
    put("viridis", "(0 '#440154', 1 '#3b528b', 2 '#21918c', 3 '#5ec962', 4 '#fde725')");
    put("jet", "(0 '#000090', 1 '#000fff', 2 '#0090ff', 3 '#0fffee', 4 '#90ff70', 5 '#ffee00', 6 '#ff7000', " +
        "7 '#ee0000', 8 '#7f0000')");
    put("bwr", "(0 '#0000ff', 1 '#ffffff', 2 '#ff0000')");
    put("hot", "(0 '#0b0000', 1 '#ff0000', 2 '#ffff00', 3 '#ffffff')");
    put("gray", "(0 '#000000', 1 '#ffffff')");
    put("binary", "(0 '#ffffff', 1 '#000000')");
  }};

  private final ProcessRunner processRunner;
  private final String gnuplotExecutable;

  public CIUGnuplotter() {
    this(new ProcessRunner(), DEFAULT_GNUPLOT);
  }

  public CIUGnuplotter(ProcessRunner processRunner, String gnuplotExecutable) {
    this.processRunner = processRunner;
    this.gnuplotExecutable = gnuplotExecutable;
  }

  /**
   * Plots a processed fingerprint to outputDir/&lt;short name&gt;&lt;extension&gt;.
   * @return The image file.
   */
  public File plotFingerprint(CIUAnalysisGrid grid, ContourLevels levels, File outputDir)
      throws IOException, ConfigurationException {
    CIUParameters params = grid.getParameters();
    PlotSpec spec = new PlotSpec(params, levels, grid.getShortName(),
        StringUtils.defaultIfBlank(params.getCiuplotCmapOverride(), DEFAULT_CMAP));
    return render(grid.getData(), grid.getAxes(), spec, new File(outputDir, grid.getShortName() + extension(params)));
  }

  /**
   * Plots the difference map of a comparison to outputDir/&lt;name1&gt;-&lt;name2&gt;&lt;extension&gt;.  Positive
   * differences (the first file is more intense) are red, negative ones blue.
   * @return The image file.
   */
  public File plotDifference(ComparisonResult result, ContourLevels levels, String name1, String name2,
                             CIUParameters params, File outputDir) throws IOException, ConfigurationException {
    PlotSpec spec = new PlotSpec(params, levels, String.format("Red: %s, Blue: %s", name1, name2), DIFFERENCE_CMAP);
    spec.legend = String.format("RMSD = %2.2f", result.getRmsd());
    if (params.getCompare1CustomRed() != null && params.getCompare2CustomBlue() != null) {
      List<Double> ticks = levels.getTicks();
      spec.tickLabels = Arrays.asList(params.getCompare2CustomBlue(), "Equal", params.getCompare1CustomRed());
      spec.tickLabels = spec.tickLabels.subList(0, Math.min(ticks.size(), spec.tickLabels.size()));
    }
    return render(result.getDifference(), result.getAxes(), spec,
        new File(outputDir, String.format("%s-%s%s", name1, name2, extension(params))));
  }

  /**
   * Plots the standard deviation map of an averaged fingerprint to outputDir/&lt;short name&gt;_stdev&lt;extension&gt;.
   * @return The image file.
   */
  public File plotStandardDeviation(CIUAnalysisGrid averaged, double[][] stdDev, ContourLevels levels,
                                    File outputDir) throws IOException, ConfigurationException {
    CIUParameters params = averaged.getParameters();
    PlotSpec spec = new PlotSpec(params, levels, averaged.getShortName(),
        StringUtils.defaultIfBlank(params.getPlot01Cmap(), DEFAULT_CMAP));
    spec.legend = String.format("Max std deviation: %.2f", Grids.max(stdDev));
    return render(stdDev, averaged.getAxes(), spec,
        new File(outputDir, averaged.getShortName() + "_stdev" + extension(params)));
  }

  private File render(double[][] data, CIUAxes axes, PlotSpec spec, File outFile)
      throws IOException, ConfigurationException {
    File dataFile = new File(outFile.getPath() + DATA_FILE_SUFFIX);
    writeMatrixData(quantize(data, spec.levels), axes, dataFile);
    String cmd = buildCommand(spec, dataFile, outFile);

    int exitCode;
    try {
      exitCode = processRunner.runProcess(gnuplotExecutable, Arrays.asList("-e", cmd), GNUPLOT_TIMEOUT_IN_SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException(String.format("Interrupted while plotting %s", outFile), e);
    }
    if (exitCode != 0) {
      throw new IOException(String.format("gnuplot exited with status %d while plotting %s", exitCode, outFile));
    }
    LOGGER.info("Wrote plot to %s", outFile.getAbsolutePath());
    return outFile;
  }

  /**
   * Replaces each cell by the contour level at the bottom of the band it falls into, which is what a filled contour
   * plot colors it with.  Cells below the lowest level are NaN and left unpainted.
   */
  static double[][] quantize(double[][] data, ContourLevels levels) {
    List<Double> bounds = levels.getLevels();
    double[][] out = new double[Grids.rows(data)][Grids.cols(data)];
    for (int i = 0; i < out.length; i++) {
      for (int j = 0; j < out[i].length; j++) {
        double v = data[i][j];
        double band = Double.NaN;
        for (Double bound : bounds) {
          if (v >= bound) {
            band = bound;
          } else {
            break;
          }
        }
        out[i][j] = band;
      }
    }
    return out;
  }

  /* Writes gnuplot's nonuniform matrix layout: a header row of the column count followed by the CV values, then one
   * row per DT bin holding the DT value and that row's intensities. */
  static void writeMatrixData(double[][] data, CIUAxes axes, File dataFile) throws IOException {
    double[] dt = axes.getDtAxis();
    double[] cv = axes.getCvAxis();
    try (PrintStream out = new PrintStream(new FileOutputStream(dataFile), false, StandardCharsets.UTF_8.name())) {
      out.print(cv.length);
      for (double c : cv) {
        out.format(Locale.US, "\t%.6f", c);
      }
      out.print("\n");
      for (int i = 0; i < dt.length; i++) {
        out.format(Locale.US, "%.6f", dt[i]);
        for (double v : data[i]) {
          out.print(Double.isNaN(v) ? "\tNaN" : String.format(Locale.US, "\t%.6f", v));
        }
        out.print("\n");
      }
      out.flush();
    }
  }

  String buildCommand(PlotSpec spec, File dataFile, File outFile) throws ConfigurationException {
    CIUParameters params = spec.params;
    String ext = extension(params);
    double width = params.getPlot03Figwidth() == null ? DEFAULT_FIG_WIDTH : params.getPlot03Figwidth();
    double height = params.getPlot04Figheight() == null ? DEFAULT_FIG_HEIGHT : params.getPlot04Figheight();
    int dpi = params.getPlot05Dpi() == null ? DEFAULT_DPI : params.getPlot05Dpi();
    int fontSize = params.getPlot13FontSize() == null ? DEFAULT_FONT_SIZE : params.getPlot13FontSize();
    String font = String.format(" font \",%d\"", fontSize);

    StringBuffer cmd = new StringBuffer();
    switch (ext) {
      case ".png":
        // png takes its size in pixels, pdf in inches
        cmd.append(String.format(Locale.US, " set terminal pngcairo size %d,%d%s;",
            Math.round(width * dpi), Math.round(height * dpi), font));
        break;
      case ".pdf":
        cmd.append(String.format(Locale.US, " set terminal pdfcairo size %.2fin,%.2fin%s;", width, height, font));
        break;
      case ".svg":
        cmd.append(String.format(Locale.US, " set terminal svg size %d,%d%s;",
            Math.round(width * dpi), Math.round(height * dpi), font));
        break;
      default:
        throw new ConfigurationException(String.format("Unsupported plot extension: %s", ext));
    }
    cmd.append(" set output \"" + escape(outFile.getPath()) + "\";");

    String title = null;
    if (params.getPlot12CustomTitle() != null) {
      title = params.getPlot12CustomTitle();
    } else if (CIUParameters.isSet(params.getPlot11ShowTitle())) {
      title = spec.defaultTitle;
    }
    if (title != null) {
      cmd.append(" set title \"" + sanitize(title) + "\"" + font + ";");
    }

    if (CIUParameters.isSet(params.getPlot08ShowAxesTitles())) {
      cmd.append(" set xlabel \"" + sanitize(StringUtils.defaultIfBlank(params.getPlot09XTitle(), DEFAULT_X_TITLE)) +
          "\"" + font + ";");
      cmd.append(" set ylabel \"" + sanitize(StringUtils.defaultIfBlank(params.getPlot10YTitle(), DEFAULT_Y_TITLE)) +
          "\"" + font + ";");
    }

    cmd.append(" set xrange " + range(params.getPlot16XlimLower(), params.getPlot17XlimUpper()) + ";");
    cmd.append(" set yrange " + range(params.getPlot18YlimLower(), params.getPlot19YlimUpper()) + ";");

    cmd.append(" set view map; unset surface; set pm3d map corners2color c1;");
    cmd.append(" set palette defined " + palette(spec.cmap) + ";");
    double cbLow = spec.levels.getLowest();
    double cbHigh = spec.levels.getHighest();
    if (cbHigh <= cbLow) {
      // A flat grid yields a single level; gnuplot refuses an empty cbrange.
      LOGGER.warn("Only one contour level (%.3f) for %s, widening the color range", cbLow, outFile.getName());
      cbHigh = cbLow + MIN_COLOR_RANGE;
    }
    cmd.append(String.format(Locale.US, " set cbrange [%s:%s];", number(cbLow), number(cbHigh)));

    if (CIUParameters.isSet(params.getPlot06ShowColorbar())) {
      List<String> tics = new ArrayList<>();
      List<Double> ticks = spec.levels.getTicks();
      for (int i = 0; i < ticks.size(); i++) {
        String label = spec.tickLabels != null && i < spec.tickLabels.size() ?
            sanitize(spec.tickLabels.get(i)) : String.format(Locale.US, "%.2f", ticks.get(i));
        tics.add(String.format("\"%s\" %s", label, number(ticks.get(i))));
      }
      cmd.append(" set cbtics (" + StringUtils.join(tics, ", ") + ");");
    } else {
      cmd.append(" unset colorbox;");
    }

    if (spec.legend != null && CIUParameters.isSet(params.getPlot07ShowLegend())) {
      cmd.append(" set label 1 \"" + sanitize(spec.legend) + "\" at graph 0.6, graph 0.05 front" + font + ";");
    }

    cmd.append(" unset key;");
    cmd.append(" splot \"" + escape(dataFile.getPath()) + "\" nonuniform matrix with pm3d;");
    cmd.append(" set output;");
    return cmd.toString();
  }

  private static String extension(CIUParameters params) {
    String ext = StringUtils.defaultIfBlank(params.getPlot02Extension(), DEFAULT_EXTENSION).toLowerCase(Locale.US);
    return ext.startsWith(".") ? ext : "." + ext;
  }

  private static String palette(String cmap) {
    String palette = PALETTES.get(cmap.toLowerCase(Locale.US));
    if (palette == null) {
      LOGGER.warn("No gnuplot palette for colormap %s, using %s", cmap, DEFAULT_CMAP);
      palette = PALETTES.get(DEFAULT_CMAP);
    }
    return palette;
  }

  private static String range(Double lower, Double upper) {
    return String.format("[%s:%s]", lower == null ? "*" : number(lower), upper == null ? "*" : number(upper));
  }

  private static String number(double v) {
    return String.format(Locale.US, "%.6g", v);
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static String sanitize(String label) {
    // Enhanced text mode treats _ as a subscript operator.
    return escape(label).replace("_", "\\\\_");
  }

  static class PlotSpec {
    final CIUParameters params;
    final ContourLevels levels;
    final String defaultTitle;
    final String cmap;
    String legend;
    List<String> tickLabels;

    PlotSpec(CIUParameters params, ContourLevels levels, String defaultTitle, String cmap) {
      this.params = params;
      this.levels = levels;
      this.defaultTitle = defaultTitle;
      this.cmap = cmap;
    }
  }
}
