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
package stormcell.core;

import stormcell.data_structure.TrackedCellCollection;
import org.json.simple.parser.ParseException;

import java.io.IOException;

/**
 * Persistence of tracked cells between scans
 * @author Jean Ollion
 */
public interface TrackedCellStore {
    /**
     * @return stored cells, empty collection if nothing is stored yet
     */
    TrackedCellCollection load() throws IOException, ParseException;
    void save(TrackedCellCollection cells) throws IOException;
}
