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

import stormcell.image.ReflectivityGrid;

import java.io.IOException;

/**
 * Provider of decoded reflectivity scans
 * @author Jean Ollion
 */
public interface GridSource {
    /**
     * @return the scan, with its timestamp
     * @throws IOException if the scan cannot be read
     */
    ReflectivityGrid getGrid() throws IOException;
}
