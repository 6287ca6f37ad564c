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

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Every option that can be set in a CIU parameter file.  An option that is null (or false, for flags) is disabled:
 * no smoothing window means no smoothing, no crop values means no cropping, no interpolation bin count (or zero)
 * means no CV resampling.  The gaussian and plot options are carried along for the fitting stage and the renderer
 * and are not interpreted by the processing code.
 *
 * Keys are the parameter file names; see {@link com.act.ciu.io.CIUParametersParser}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CIUParameters implements Serializable {
  private static final long serialVersionUID = 6321598340093386154L;

  public static final String SMOOTHING_METHOD_SAVGOL = "savgol";
  public static final int DEFAULT_SMOOTHING_ITERATIONS = 1;

  // Raw processing
  @JsonProperty("smoothing_method")
  private String smoothingMethod;

  @JsonProperty("smoothing_window")
  private Integer smoothingWindow;

  @JsonProperty("smoothing_iterations")
  private Integer smoothingIterations;

  @JsonProperty("cropping_window_values")
  private List<Double> croppingWindowValues;

  @JsonProperty("interpolation_bins")
  private Integer interpolationBins;

  // Gaussian fitting
  @JsonProperty("gaussian_int_threshold")
  private Double gaussianIntThreshold;

  @JsonProperty("gaussian_min_spacing")
  private Double gaussianMinSpacing;

  @JsonProperty("gaussian_width_max")
  private Double gaussianWidthMax;

  @JsonProperty("gaussian_centroid_bound_filter")
  private List<Double> gaussianCentroidBoundFilter;

  @JsonProperty("gaussian_centroid_plot_bounds")
  private List<Double> gaussianCentroidPlotBounds;

  // Plotting
  @JsonProperty("plot_01_cmap")
  private String plot01Cmap;

  @JsonProperty("plot_02_extension")
  private String plot02Extension;

  @JsonProperty("plot_03_figwidth")
  private Double plot03Figwidth;

  @JsonProperty("plot_04_figheight")
  private Double plot04Figheight;

  @JsonProperty("plot_05_dpi")
  private Integer plot05Dpi;

  @JsonProperty("plot_06_show_colorbar")
  private Boolean plot06ShowColorbar;

  @JsonProperty("plot_07_show_legend")
  private Boolean plot07ShowLegend;

  @JsonProperty("plot_08_show_axes_titles")
  private Boolean plot08ShowAxesTitles;

  @JsonProperty("plot_09_x_title")
  private String plot09XTitle;

  @JsonProperty("plot_10_y_title")
  private String plot10YTitle;

  @JsonProperty("plot_11_show_title")
  private Boolean plot11ShowTitle;

  @JsonProperty("plot_12_custom_title")
  private String plot12CustomTitle;

  @JsonProperty("plot_13_font_size")
  private Integer plot13FontSize;

  @JsonProperty("plot_16_xlim_lower")
  private Double plot16XlimLower;

  @JsonProperty("plot_17_xlim_upper")
  private Double plot17XlimUpper;

  @JsonProperty("plot_18_ylim_lower")
  private Double plot18YlimLower;

  @JsonProperty("plot_19_ylim_upper")
  private Double plot19YlimUpper;

  @JsonProperty("ciuplot_cmap_override")
  private String ciuplotCmapOverride;

  // Comparison
  @JsonProperty("compare_1_custom_red")
  private String compare1CustomRed;

  @JsonProperty("compare_2_custom_blue")
  private String compare2CustomBlue;

  @JsonProperty("compare_3_high_contrast")
  private Boolean compare3HighContrast;

  // Output
  @JsonProperty("output_1_save_csv")
  private Boolean output1SaveCsv;

  @JsonIgnore
  private transient Set<String> unrecognizedKeys = new TreeSet<>();

  public CIUParameters() {
  }

  @JsonAnySetter
  void recordUnrecognizedKey(String key, Object value) {
    if (unrecognizedKeys == null) {
      unrecognizedKeys = new TreeSet<>();
    }
    unrecognizedKeys.add(key);
  }

  /**
   * @return Keys that were supplied when this object was populated but that do not name any option.
   */
  @JsonIgnore
  public Set<String> getUnrecognizedKeys() {
    return unrecognizedKeys == null ? Collections.emptySet() : Collections.unmodifiableSet(unrecognizedKeys);
  }

  public String getSmoothingMethod() {
    return smoothingMethod;
  }

  public void setSmoothingMethod(String smoothingMethod) {
    this.smoothingMethod = smoothingMethod;
  }

  public Integer getSmoothingWindow() {
    return smoothingWindow;
  }

  public void setSmoothingWindow(Integer smoothingWindow) {
    this.smoothingWindow = smoothingWindow;
  }

  public Integer getSmoothingIterations() {
    return smoothingIterations;
  }

  public void setSmoothingIterations(Integer smoothingIterations) {
    this.smoothingIterations = smoothingIterations;
  }

  /**
   * @return The number of smoothing passes to run; one pass if a window is set but no iteration count is.
   */
  @JsonIgnore
  public int getEffectiveSmoothingIterations() {
    if (smoothingWindow == null) {
      return 0;
    }
    return smoothingIterations == null ? DEFAULT_SMOOTHING_ITERATIONS : smoothingIterations;
  }

  public List<Double> getCroppingWindowValues() {
    return croppingWindowValues == null ? null : new ArrayList<>(croppingWindowValues);
  }

  public void setCroppingWindowValues(List<Double> croppingWindowValues) {
    this.croppingWindowValues = croppingWindowValues == null ? null : new ArrayList<>(croppingWindowValues);
  }

  public Integer getInterpolationBins() {
    return interpolationBins;
  }

  public void setInterpolationBins(Integer interpolationBins) {
    this.interpolationBins = interpolationBins;
  }

  @JsonIgnore
  public boolean isInterpolationEnabled() {
    return interpolationBins != null && interpolationBins > 0;
  }

  public Double getGaussianIntThreshold() {
    return gaussianIntThreshold;
  }

  public Double getGaussianMinSpacing() {
    return gaussianMinSpacing;
  }

  public Double getGaussianWidthMax() {
    return gaussianWidthMax;
  }

  public List<Double> getGaussianCentroidBoundFilter() {
    return gaussianCentroidBoundFilter;
  }

  public List<Double> getGaussianCentroidPlotBounds() {
    return gaussianCentroidPlotBounds;
  }

  public String getPlot01Cmap() {
    return plot01Cmap;
  }

  public String getPlot02Extension() {
    return plot02Extension;
  }

  public Double getPlot03Figwidth() {
    return plot03Figwidth;
  }

  public Double getPlot04Figheight() {
    return plot04Figheight;
  }

  public Integer getPlot05Dpi() {
    return plot05Dpi;
  }

  public Boolean getPlot06ShowColorbar() {
    return plot06ShowColorbar;
  }

  public Boolean getPlot07ShowLegend() {
    return plot07ShowLegend;
  }

  public Boolean getPlot08ShowAxesTitles() {
    return plot08ShowAxesTitles;
  }

  public String getPlot09XTitle() {
    return plot09XTitle;
  }

  public String getPlot10YTitle() {
    return plot10YTitle;
  }

  public Boolean getPlot11ShowTitle() {
    return plot11ShowTitle;
  }

  public String getPlot12CustomTitle() {
    return plot12CustomTitle;
  }

  public Integer getPlot13FontSize() {
    return plot13FontSize;
  }

  public Double getPlot16XlimLower() {
    return plot16XlimLower;
  }

  public Double getPlot17XlimUpper() {
    return plot17XlimUpper;
  }

  public Double getPlot18YlimLower() {
    return plot18YlimLower;
  }

  public Double getPlot19YlimUpper() {
    return plot19YlimUpper;
  }

  public String getCiuplotCmapOverride() {
    return ciuplotCmapOverride;
  }

  public String getCompare1CustomRed() {
    return compare1CustomRed;
  }

  public String getCompare2CustomBlue() {
    return compare2CustomBlue;
  }

  public Boolean getCompare3HighContrast() {
    return compare3HighContrast;
  }

  public void setCompare3HighContrast(Boolean compare3HighContrast) {
    this.compare3HighContrast = compare3HighContrast;
  }

  public Boolean getOutput1SaveCsv() {
    return output1SaveCsv;
  }

  public void setOutput1SaveCsv(Boolean output1SaveCsv) {
    this.output1SaveCsv = output1SaveCsv;
  }

  // Flags read as false when unset.
  public static boolean isSet(Boolean flag) {
    return Boolean.TRUE.equals(flag);
  }
}
