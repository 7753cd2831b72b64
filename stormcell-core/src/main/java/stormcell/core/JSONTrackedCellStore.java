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

import stormcell.data_structure.TrackedCell;
import stormcell.data_structure.TrackedCellCollection;
import stormcell.utils.JSONUtils;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores tracked cells as a JSON array in a single file. Fields unknown to this program are kept, in their original order.
 * Records sharing the same id are merged at loading.
 * @author Jean Ollion
 */
public class JSONTrackedCellStore implements TrackedCellStore {
    public final static Logger logger = LoggerFactory.getLogger(JSONTrackedCellStore.class);
    final Path file;
    int floatPrecision = 4;

    public JSONTrackedCellStore(Path file) {
        this.file = file;
    }

    /**
     * @param floatPrecision number of decimals of written floating point values. negative value: full precision
     */
    public JSONTrackedCellStore setFloatPrecision(int floatPrecision) {
        this.floatPrecision = floatPrecision;
        return this;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public TrackedCellCollection load() throws IOException, ParseException {
        if (!Files.exists(file)) {
            logger.info("no tracked cell file at {}: starting from an empty collection", file);
            return new TrackedCellCollection();
        }
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        TrackedCellCollection res = parse(content);
        logger.debug("loaded {} tracked cells from {}", res.size(), file);
        return res;
    }

    public static TrackedCellCollection parse(String content) throws ParseException {
        TrackedCellCollection res = new TrackedCellCollection();
        if (content.trim().isEmpty()) return res;
        Object json = JSONUtils.parseOrdered(content);
        if (!(json instanceof List)) throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, json);
        int count = 0;
        for (Object o : (List)json) {
            res.addOrMerge(TrackedCell.fromJSONEntry(o));
            ++count;
        }
        if (count != res.size()) logger.info("{} duplicated track record(s) merged", count - res.size());
        return res;
    }

    public static String toJSONString(TrackedCellCollection cells, int floatPrecision) {
        List<Object> res = new ArrayList<>(cells.size());
        cells.stream().forEach(c -> res.add(c.toJSONEntry(floatPrecision)));
        return JSONUtils.toJSONString(res);
    }

    /**
     * Writes to a temporary file then replaces the stored file
     */
    @Override
    public void save(TrackedCellCollection cells) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent!=null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName().toString()+".tmp");
        Files.write(tmp, toJSONString(cells, floatPrecision).getBytes(StandardCharsets.UTF_8));
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        logger.debug("saved {} tracked cells to {}", cells.size(), file);
    }
}
