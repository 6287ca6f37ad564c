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
import com.act.ciu.model.CIUAxes;
import com.act.ciu.model.CIUParameters;
import com.act.ciu.model.CIURawMatrix;
import com.act.ciu.model.CropBounds;
import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.util.Arrays;

import static com.act.ciu.TestGrids.FP_TOLERANCE;
import static com.act.ciu.TestGrids.assertGridEquals;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;

public class RawProcessingPipelineTest {
  private CIURawMatrix raw;

  @Before
  public void setUp() {
    double[] dt = new double[]{1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0};
    double[] cv = new double[]{10.0, 15.0, 20.0};
    double[][] data = new double[dt.length][cv.length];
    for (int i = 0; i < dt.length; i++) {
      data[i][0] = 2.0 * (i + 1);
      data[i][1] = 7.0 - i;
      data[i][2] = 0.0;
    }
    raw = new CIURawMatrix("sample_raw.csv", "/data/sample_raw.csv", data, new CIUAxes(dt, cv));
  }

  @Test
  public void testDefaultParametersOnlyNormalize() throws Exception {
    CIUAnalysisGrid out = new RawProcessingPipeline().process(raw, new CIUParameters());
    assertGridEquals("Normalized raw data", new ColumnNormalizer().normalize(raw.getRawData()), out.getData(),
        FP_TOLERANCE);
    assertEquals(raw.getAxes(), out.getAxes());
    assertEquals("Provenance is the raw file", raw, out.getRaw());
    assertEquals("sample", out.getShortName());
  }

  @Test
  public void testStagesRunInOrder() throws Exception {
    ColumnNormalizer normalizer = Mockito.mock(ColumnNormalizer.class);
    GridInterpolator interpolator = Mockito.mock(GridInterpolator.class);
    SavitzkyGolaySmoother smoother = Mockito.mock(SavitzkyGolaySmoother.class);
    GridCropper cropper = Mockito.mock(GridCropper.class);
    Mockito.when(normalizer.normalize(any(double[][].class))).thenAnswer(inv -> inv.getArgument(0));
    Mockito.when(interpolator.resampleCv(any(CIUAnalysisGrid.class), anyInt())).thenAnswer(inv -> inv.getArgument(0));
    Mockito.when(smoother.smooth(any(double[][].class), anyInt(), anyInt())).thenAnswer(inv -> inv.getArgument(0));
    Mockito.when(cropper.crop(any(CIUAnalysisGrid.class), any(CropBounds.class))).thenAnswer(inv -> inv.getArgument(0));

    CIUParameters params = new CIUParameters();
    params.setInterpolationBins(4);
    params.setSmoothingWindow(5);
    params.setCroppingWindowValues(Arrays.asList(10.0, 20.0, 2.0, 6.0));

    new RawProcessingPipeline(normalizer, interpolator, smoother, cropper).process(raw, params);

    InOrder inOrder = Mockito.inOrder(normalizer, interpolator, smoother, cropper);
    inOrder.verify(normalizer).normalize(any(double[][].class));
    inOrder.verify(interpolator).resampleCv(any(CIUAnalysisGrid.class), eq(4));
    inOrder.verify(smoother).smooth(any(double[][].class), eq(5), eq(1));
    inOrder.verify(cropper).crop(any(CIUAnalysisGrid.class), any(CropBounds.class));
  }

  @Test
  public void testDisabledStagesAreSkipped() throws Exception {
    GridInterpolator interpolator = Mockito.mock(GridInterpolator.class);
    SavitzkyGolaySmoother smoother = Mockito.mock(SavitzkyGolaySmoother.class);
    GridCropper cropper = Mockito.mock(GridCropper.class);

    CIUParameters params = new CIUParameters();
    params.setInterpolationBins(0);
    new RawProcessingPipeline(new ColumnNormalizer(), interpolator, smoother, cropper).process(raw, params);

    Mockito.verifyNoInteractions(interpolator, smoother, cropper);
  }

  @Test
  public void testFullPipeline() throws Exception {
    CIUParameters params = new CIUParameters();
    params.setSmoothingMethod(CIUParameters.SMOOTHING_METHOD_SAVGOL);
    params.setSmoothingWindow(5);
    params.setSmoothingIterations(2);
    params.setInterpolationBins(5);
    params.setCroppingWindowValues(Arrays.asList(10.0, 17.5, 2.0, 6.0));

    CIUAnalysisGrid out = new RawProcessingPipeline().process(raw, params);
    // CV 10..20 in 5 bins is 10, 12.5, 15, 17.5, 20; the crop keeps 10 through 17.5.
    assertArrayEquals(new double[]{10.0, 12.5, 15.0, 17.5}, out.getAxes().getCvAxis(), FP_TOLERANCE);
    assertArrayEquals(new double[]{2.0, 3.0, 4.0, 5.0, 6.0}, out.getAxes().getDtAxis(), FP_TOLERANCE);
    assertEquals(5, out.getNumRows());
    assertEquals(4, out.getNumCols());
    // The first column rises linearly, which smoothing leaves alone.
    assertEquals(2.0 / 7.0, out.getData()[0][0], FP_TOLERANCE);
  }

  @Test(expected = ConfigurationException.class)
  public void testUnknownSmoothingMethod() throws Exception {
    CIUParameters params = new CIUParameters();
    params.setSmoothingMethod("gaussian");
    params.setSmoothingWindow(5);
    new RawProcessingPipeline().process(raw, params);
  }

  @Test(expected = ConfigurationException.class)
  public void testCropValuesMustBeFour() throws Exception {
    CIUParameters params = new CIUParameters();
    params.setCroppingWindowValues(Arrays.asList(10.0, 20.0, 2.0));
    new RawProcessingPipeline().process(raw, params);
  }
}
