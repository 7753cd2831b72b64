/* 
 * Copyright (C) 2025 Jean Ollion
 *
 * This File is part of STORMCELL
 *
 * STORMCELL is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * STORMCELL is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with STORMCELL.  If not, see <http://www.gnu.org/licenses/>.
 */
package stormcell.processing.matching;

/**
 * Accepted pairing between a cell of the previous scan and a cell of the current scan
 * @author Jean Ollion
 */
public class Match {
    public final int oldIndex, newIndex;
    public final double cost;

    public Match(int oldIndex, int newIndex, double cost) {
        this.oldIndex = oldIndex;
        this.newIndex = newIndex;
        this.cost = cost;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Match)) return false;
        Match m = (Match) o;
        return m.oldIndex == oldIndex && m.newIndex == newIndex && Double.compare(m.cost, cost) == 0;
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 37 * hash + oldIndex;
        hash = 37 * hash + newIndex;
        hash = 37 * hash + Double.hashCode(cost);
        return hash;
    }

    @Override
    public String toString() {
        return oldIndex+"->"+newIndex+" ("+cost+")";
    }
}
