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

import com.act.ciu.model.CIUAxes;
import com.act.ciu.model.CIURawMatrix;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static com.act.ciu.TestGrids.assertGridEquals;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;

public class CIUCsvWriterTest {
  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private static final double[][] DATA = new double[][]{{0.25, 1.0}, {0.5, 0.0}};
  private static final CIUAxes AXES = new CIUAxes(new double[]{1.5, 2.5}, new double[]{10.0, 20.0});

  @Test
  public void testWrittenGridReadsBack() throws Exception {
    File target = new File(tempFolder.getRoot(), "written_raw.csv");
    new CIUCsvWriter().write(target, DATA, AXES);

    List<String> lines = Files.readAllLines(target.toPath(), StandardCharsets.UTF_8);
    assertEquals(Arrays.asList(",10.0,20.0", "1.5,0.25,1.0", "2.5,0.5,0.0"), lines);

    CIURawMatrix back = new CIUCsvParser().parse(target);
    assertGridEquals("Data", DATA, back.getRawData(), 0.0);
    assertArrayEquals(AXES.getCvAxis(), back.getAxes().getCvAxis(), 0.0);
  }

  @Test
  public void testEmbeddedAxesWrittenAsIs() throws Exception {
    File target = new File(tempFolder.getRoot(), "embedded.csv");
    new CIUCsvWriter().writeWithEmbeddedAxes(target, new double[][]{{0.0, 10.0}, {1.5, 0.25}});
    assertEquals(Arrays.asList("0.0,10.0", "1.5,0.25"), Files.readAllLines(target.toPath(), StandardCharsets.UTF_8));
  }

  private File blockedTarget() throws IOException {
    // A path beneath a regular file can never be opened for writing.
    File blocker = tempFolder.newFile("blocker");
    return new File(blocker, "out_raw.csv");
  }

  @Test
  public void testDecliningHandlerFailsWithoutRetry() throws Exception {
    WriteContentionHandler handler = Mockito.mock(WriteContentionHandler.class);
    Mockito.when(handler.awaitRelease(any(File.class), any(IOException.class))).thenReturn(false);
    File target = blockedTarget();
    try {
      new CIUCsvWriter(handler).write(target, DATA, AXES);
      fail("Write should fail");
    } catch (WriteContentionException e) {
      assertEquals(target, e.getTarget());
    }
    Mockito.verify(handler, Mockito.times(1)).awaitRelease(eq(target), any(IOException.class));
  }

  @Test
  public void testRetryHappensExactlyOnce() throws Exception {
    WriteContentionHandler handler = Mockito.mock(WriteContentionHandler.class);
    Mockito.when(handler.awaitRelease(any(File.class), any(IOException.class))).thenReturn(true);
    File target = blockedTarget();
    try {
      new CIUCsvWriter(handler).write(target, DATA, AXES);
      fail("Write should fail after the retry");
    } catch (WriteContentionException e) {
      assertTrue(e.getCause() instanceof IOException);
    }
    Mockito.verify(handler, Mockito.times(1)).awaitRelease(eq(target), any(IOException.class));
  }

  @Test
  public void testRetrySucceedsOnceReleased() throws Exception {
    File target = blockedTarget();
    File blocker = target.getParentFile();
    WriteContentionHandler handler = (file, cause) -> blocker.delete() && blocker.mkdir();

    new CIUCsvWriter(handler).write(target, DATA, AXES);
    assertTrue(target.exists());
  }
}
