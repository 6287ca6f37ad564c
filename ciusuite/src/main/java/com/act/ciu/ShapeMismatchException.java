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

/**
 * Thrown when grids (or a grid and its axes) that must agree in shape do not.
 */
public class ShapeMismatchException extends RuntimeException {
  public ShapeMismatchException(String msg) {
    super(msg);
  }

  public static ShapeMismatchException forShapes(String what, int rowsA, int colsA, int rowsB, int colsB) {
    return new ShapeMismatchException(
        String.format("%s: %d x %d does not match %d x %d", what, rowsA, colsA, rowsB, colsB));
  }
}
