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

import java.io.File;
import java.io.IOException;

/**
 * Decides what to do when an output file cannot be written because something else holds it (it is open in another
 * program, or locked, or read-only).  Writers ask once; there is no second chance after a retry fails.
 */
public interface WriteContentionHandler {

  /**
   * Called when a write to target failed.  Implementations typically tell the user and wait for them to release the
   * file.
   * @param target The file that could not be written.
   * @param cause The failure.
   * @return True to retry the write once, false to give up.
   */
  boolean awaitRelease(File target, IOException cause);

  WriteContentionHandler FAIL_FAST = (target, cause) -> false;
}
