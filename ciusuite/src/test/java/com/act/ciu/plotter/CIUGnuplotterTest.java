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
import com.act.ciu.io.CIUParametersParser;
import com.act.ciu.model.CIUAnalysisGrid;
import com.act.ciu.model.CIUAxes;
import com.act.ciu.model.CIUParameters;
import com.act.ciu.utils.ProcessRunner;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.act.ciu.TestGrids.grid;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;

public class CIUGnuplotterTest {
  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private ProcessRunner mockRunner;
  private CIUGnuplotter plotter;
  private ContourLevels levels;

  @Before
  public void setUp() throws Exception {
    mockRunner = Mockito.mock(ProcessRunner.class);
    Mockito.when(mockRunner.runProcess(eq("gnuplot"), anyList(), anyLong())).thenReturn(0);
    plotter = new CIUGnuplotter(mockRunner, "gnuplot");
    levels = new ContourLevelGenerator().fingerprintLevels(new double[][]{{0.0, 1.0}});
  }

  private static CIUParameters params(String... keysAndValues) throws ConfigurationException {
    Map<String, String> values = new HashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      values.put(keysAndValues[i], keysAndValues[i + 1]);
    }
    return new CIUParametersParser(true).toParameters(values);
  }

  private String command(CIUParameters params, String title) throws ConfigurationException {
    CIUGnuplotter.PlotSpec spec = new CIUGnuplotter.PlotSpec(params, levels, title, CIUGnuplotter.DEFAULT_CMAP);
    return plotter.buildCommand(spec, new File("/out/sample.png.gnuplot.dat"), new File("/out/sample.png"));
  }

  @Test
  public void testDefaultCommand() throws Exception {
    String cmd = command(new CIUParameters(), "sample");
    assertTrue(cmd, cmd.contains("set terminal pngcairo size 640,480 font \",12\";"));
    assertTrue(cmd, cmd.contains("set output \"/out/sample.png\";"));
    assertTrue(cmd, cmd.contains("set xrange [*:*];"));
    assertTrue(cmd, cmd.contains("set yrange [*:*];"));
    assertTrue(cmd, cmd.contains("unset colorbox;"));
    assertTrue(cmd, cmd.contains("splot \"/out/sample.png.gnuplot.dat\" nonuniform matrix with pm3d;"));
    assertTrue("Output is closed at the end", cmd.endsWith(" set output;"));
    assertFalse("No title unless asked for", cmd.contains("set title"));
    assertFalse("No axis titles unless asked for", cmd.contains("set xlabel"));
  }

  @Test
  public void testTitlesAndLimits() throws Exception {
    String cmd = command(params(
        "plot_11_show_title", "True",
        "plot_08_show_axes_titles", "true",
        "plot_10_y_title", "DT",
        "plot_16_xlim_lower", "20",
        "plot_13_font_size", "9"), "my_sample");
    assertTrue(cmd, cmd.contains("set title \"my\\\\_sample\" font \",9\";"));
    assertTrue(cmd, cmd.contains("set xlabel \"Collision Voltage (V)\""));
    assertTrue(cmd, cmd.contains("set ylabel \"DT\""));
    assertTrue(cmd, cmd.contains("set xrange [20.0000:*];"));
  }

  @Test
  public void testCustomTitleWins() throws Exception {
    String cmd = command(params("plot_12_custom_title", "Custom", "plot_11_show_title", "false"), "sample");
    assertTrue(cmd, cmd.contains("set title \"Custom\""));
  }

  @Test
  public void testColorbarTicks() throws Exception {
    String cmd = command(params("plot_06_show_colorbar", "true"), "sample");
    assertTrue(cmd, cmd.contains("set cbtics (\"0.00\""));
    assertTrue(cmd, cmd.contains("\"0.25\""));
    assertFalse(cmd, cmd.contains("unset colorbox"));
  }

  @Test
  public void testFlatGridGetsNonEmptyColorRange() throws Exception {
    levels = new ContourLevelGenerator().fingerprintLevels(new double[][]{{0.0, 0.0}, {0.0, 0.0}});
    assertEquals("A flat grid has a single level", 1, levels.getLevels().size());

    String cmd = command(new CIUParameters(), "flat");
    int start = cmd.indexOf("set cbrange [");
    assertTrue(cmd, start >= 0);
    String[] bounds = cmd.substring(start + "set cbrange [".length(), cmd.indexOf(']', start)).split(":");
    double low = Double.parseDouble(bounds[0]);
    double high = Double.parseDouble(bounds[1]);
    assertEquals(-0.01, low, 1e-9);
    assertTrue("Color range has some width: " + low + ":" + high, high > low);
  }

  @Test
  public void testPdfTerminal() throws Exception {
    String cmd = command(params("plot_02_extension", "pdf", "plot_03_figwidth", "5", "plot_04_figheight", "3"), "s");
    assertTrue(cmd, cmd.contains("set terminal pdfcairo size 5.00in,3.00in"));
  }

  @Test(expected = ConfigurationException.class)
  public void testUnsupportedExtension() throws Exception {
    command(params("plot_02_extension", ".bmp"), "sample");
  }

  @Test
  public void testQuantizeSnapsToBandFloor() {
    ContourLevels bands = new ContourLevels(Arrays.asList(0.0, 0.5, 1.0), Arrays.asList(0.0, 1.0));
    double[][] out = CIUGnuplotter.quantize(new double[][]{{-0.1, 0.2, 0.5, 0.99, 1.2}}, bands);
    assertTrue("Below every level is unpainted", Double.isNaN(out[0][0]));
    assertEquals(0.0, out[0][1], 0.0);
    assertEquals(0.5, out[0][2], 0.0);
    assertEquals(0.5, out[0][3], 0.0);
    assertEquals(1.0, out[0][4], 0.0);
  }

  @Test
  public void testWriteMatrixData() throws Exception {
    File dataFile = tempFolder.newFile("grid.dat");
    CIUGnuplotter.writeMatrixData(new double[][]{{0.5, Double.NaN}},
        new CIUAxes(new double[]{1.5}, new double[]{10.0, 20.0}), dataFile);
    List<String> lines = Files.readAllLines(dataFile.toPath(), StandardCharsets.UTF_8);
    assertEquals(Arrays.asList("2\t10.000000\t20.000000", "1.500000\t0.500000\tNaN"), lines);
  }

  @Test
  public void testPlotFingerprintRunsGnuplot() throws Exception {
    CIUAnalysisGrid g = grid("sample", new double[][]{{0.0, 1.0}, {0.5, 0.2}},
        new double[]{1.0, 2.0}, new double[]{5.0, 10.0});
    File outDir = tempFolder.newFolder("plots");

    File out = plotter.plotFingerprint(g, levels, outDir);
    assertEquals(new File(outDir, "sample.png"), out);
    assertTrue("Data file is written for gnuplot", new File(outDir, "sample.png.gnuplot.dat").exists());

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> args = ArgumentCaptor.forClass(List.class);
    Mockito.verify(mockRunner).runProcess(eq("gnuplot"), args.capture(), anyLong());
    assertEquals("-e", args.getValue().get(0));
    assertTrue(args.getValue().get(1).contains("set palette defined"));
  }

  @Test
  public void testPlotDifferenceLabels() throws Exception {
    CIUParameters params = params(
        "compare_1_custom_red", "Holo",
        "compare_2_custom_blue", "Apo",
        "plot_06_show_colorbar", "true",
        "plot_07_show_legend", "true",
        "plot_11_show_title", "true");
    ComparisonResult result = new ComparisonResult(new double[][]{{0.2, -0.2}},
        new CIUAxes(new double[]{1.0}, new double[]{5.0, 10.0}), 12.5, false);
    ContourLevels diffLevels = new ContourLevelGenerator().differenceLevels(result.getDifference(), false);
    File outDir = tempFolder.newFolder("diff");

    File out = plotter.plotDifference(result, diffLevels, "Holo", "Apo", params, outDir);
    assertEquals(new File(outDir, "Holo-Apo.png"), out);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> args = ArgumentCaptor.forClass(List.class);
    Mockito.verify(mockRunner).runProcess(eq("gnuplot"), args.capture(), anyLong());
    String cmd = args.getValue().get(1);
    assertTrue(cmd, cmd.contains("set title \"Red: Holo, Blue: Apo\""));
    assertTrue(cmd, cmd.contains("set cbtics (\"Apo\""));
    assertTrue(cmd, cmd.contains("\"Equal\""));
    assertTrue(cmd, cmd.contains("RMSD = 12.50"));
  }

  @Test(expected = IOException.class)
  public void testGnuplotFailure() throws Exception {
    Mockito.when(mockRunner.runProcess(eq("gnuplot"), anyList(), anyLong())).thenReturn(1);
    CIUAnalysisGrid g = grid("sample", new double[][]{{0.0, 1.0}}, new double[]{1.0}, new double[]{5.0, 10.0});
    plotter.plotFingerprint(g, levels, tempFolder.newFolder("fail"));
  }
}
