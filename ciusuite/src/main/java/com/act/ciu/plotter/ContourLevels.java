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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Strictly ascending contour boundaries, with the colorbar ticks a renderer should show alongside them.
 */
public class ContourLevels {
  private final List<Double> levels;
  private final List<Double> ticks;

  public ContourLevels(List<Double> levels, List<Double> ticks) {
    for (int i = 1; i < levels.size(); i++) {
      if (!(levels.get(i) > levels.get(i - 1))) {
        throw new IllegalArgumentException(String.format(
            "Contour levels must be strictly ascending, but level %d (%f) follows %f",
            i, levels.get(i), levels.get(i - 1)));
      }
    }
    this.levels = Collections.unmodifiableList(new ArrayList<>(levels));
    this.ticks = Collections.unmodifiableList(new ArrayList<>(ticks));
  }

  public List<Double> getLevels() {
    return levels;
  }

  public List<Double> getTicks() {
    return ticks;
  }

  public double getLowest() {
    return levels.get(0);
  }

  public double getHighest() {
    return levels.get(levels.size() - 1);
  }

  public int size() {
    return levels.size();
  }

  @Override
  public String toString() {
    return String.format("ContourLevels{%d levels from %.3f to %.3f}", levels.size(), getLowest(), getHighest());
  }
}
