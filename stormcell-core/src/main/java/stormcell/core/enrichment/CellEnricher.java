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
package stormcell.core.enrichment;

import stormcell.data_structure.TrackedCellCollection;

import java.io.IOException;
import java.util.Set;

/**
 * Source of auxiliary measurements written on the history snapshots of tracked cells.
 * Enrichers receive their own copy of the tracked cells and must only write the fields they declare.
 * @author Jean Ollion
 */
public interface CellEnricher {
    /**
     * @return unique name of the source, used in logs and error reports
     */
    String getName();
    Set<EnrichmentField> getFields();

    /**
     * Writes declared fields on snapshots of {@param cells}
     * @throws IOException if the source dataset cannot be read
     */
    void enrich(TrackedCellCollection cells) throws IOException;
}
