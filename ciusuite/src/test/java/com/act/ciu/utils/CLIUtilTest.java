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

import com.act.ciu.CIUSuite;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.MissingOptionException;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CLIUtilTest {

  private static CLIUtil cliUtil() {
    return new CLIUtil(CIUSuite.class, CIUSuite.HELP_MESSAGE, CIUSuite.OPTION_BUILDERS);
  }

  @Test
  public void testHelpIsAlwaysAvailable() {
    assertTrue(cliUtil().getOptions().hasOption("help"));
  }

  @Test
  public void testParseSuiteOptions() throws Exception {
    CommandLine cl = cliUtil().parse(new String[]{
        "--mode", "compare", "-i", "a_raw.csv,b.ciu.json", "--delta-dt"});
    assertEquals(CIUSuite.MODE_COMPARE, cl.getOptionValue(CIUSuite.OPTION_MODE));
    assertArrayEquals(new String[]{"a_raw.csv", "b.ciu.json"}, cl.getOptionValues(CIUSuite.OPTION_INPUTS));
    assertTrue(cl.hasOption(CIUSuite.OPTION_DELTA_DT));
    assertFalse(cl.hasOption(CIUSuite.OPTION_NO_PLOTS));
  }

  @Test(expected = MissingOptionException.class)
  public void testModeIsRequired() throws Exception {
    cliUtil().parse(new String[]{"-i", "a_raw.csv"});
  }
}
