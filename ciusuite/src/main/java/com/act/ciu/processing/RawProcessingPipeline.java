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

package com.act.ciu.processing;

import com.act.ciu.ConfigurationException;
import com.act.ciu.model.CIUAnalysisGrid;
import com.act.ciu.model.CIUParameters;
import com.act.ciu.model.CIURawMatrix;
import com.act.ciu.model.CropBounds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns a raw fingerprint into an analysis grid: column normalization, then (as the parameters ask) CV resampling,
 * smoothing and cropping, in that order.
 */
public class RawProcessingPipeline {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RawProcessingPipeline.class);

  private final ColumnNormalizer normalizer;
  private final GridInterpolator interpolator;
  private final SavitzkyGolaySmoother smoother;
  private final GridCropper cropper;

  public RawProcessingPipeline() {
    this(new ColumnNormalizer(), new GridInterpolator(), new SavitzkyGolaySmoother(), new GridCropper());
  }

  public RawProcessingPipeline(ColumnNormalizer normalizer, GridInterpolator interpolator,
                               SavitzkyGolaySmoother smoother, GridCropper cropper) {
    this.normalizer = normalizer;
    this.interpolator = interpolator;
    this.smoother = smoother;
    this.cropper = cropper;
  }

  public CIUAnalysisGrid process(CIURawMatrix raw, CIUParameters params) throws ConfigurationException {
    LOGGER.info("Processing %s (%d DT x %d CV bins)", raw.getFilename(),
        raw.getAxes().getDtLength(), raw.getAxes().getCvLength());

    CIUAnalysisGrid grid = new CIUAnalysisGrid(raw, normalizer.normalize(raw.getRawData()), raw.getAxes(), params);

    if (params.isInterpolationEnabled()) {
      LOGGER.info("Interpolating %s onto %d CV bins", raw.getFilename(), params.getInterpolationBins());
      grid = interpolator.resampleCv(grid, params.getInterpolationBins());
    }

    if (params.getSmoothingWindow() != null) {
      String method = params.getSmoothingMethod();
      if (method != null && !CIUParameters.SMOOTHING_METHOD_SAVGOL.equalsIgnoreCase(method)) {
        throw new ConfigurationException(String.format("Unknown smoothing method: %s", method));
      }
      int iterations = params.getEffectiveSmoothingIterations();
      LOGGER.info("Smoothing %s: window %d, %d iteration(s)", raw.getFilename(), params.getSmoothingWindow(),
          iterations);
      grid = grid.withData(smoother.smooth(grid.getData(), params.getSmoothingWindow(), iterations), grid.getAxes());
    }

    if (params.getCroppingWindowValues() != null) {
      CropBounds bounds = CropBounds.fromValues(params.getCroppingWindowValues());
      LOGGER.info("Cropping %s to %s", raw.getFilename(), bounds);
      grid = cropper.crop(grid, bounds);
    }

    return grid;
  }
}
