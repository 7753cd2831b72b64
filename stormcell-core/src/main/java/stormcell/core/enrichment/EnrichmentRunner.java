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

import stormcell.data_structure.HistorySnapshot;
import stormcell.data_structure.TrackedCell;
import stormcell.data_structure.TrackedCellCollection;
import stormcell.utils.MultipleException;
import stormcell.utils.Pair;
import stormcell.utils.ThreadRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs enrichment sources concurrently, each on its own deep copy of the tracked cells,
 * then merges their declared fields into the tracked cells sequentially, in source order.
 * When a source fails, its required fields are set to a sentinel value on the latest snapshot of every track; other sources are not affected.
 * @author Jean Ollion
 */
public class EnrichmentRunner {
    public final static Logger logger = LoggerFactory.getLogger(EnrichmentRunner.class);
    final List<CellEnricher> enrichers;
    int numThreads = 1;

    /**
     * @throws IllegalArgumentException if two enrichers share a name
     */
    public EnrichmentRunner(List<CellEnricher> enrichers) {
        Set<String> names = new HashSet<>();
        for (CellEnricher e : enrichers) if (!names.add(e.getName())) throw new IllegalArgumentException("Duplicated enricher name: "+e.getName());
        this.enrichers = new ArrayList<>(enrichers);
    }

    public EnrichmentRunner setNumThreads(int numThreads) {
        this.numThreads = numThreads;
        return this;
    }

    static class Task {
        final CellEnricher enricher;
        final TrackedCellCollection copy;
        Task(CellEnricher enricher, TrackedCellCollection copy) {
            this.enricher = enricher;
            this.copy = copy;
        }
        @Override
        public String toString() {
            return enricher.getName();
        }
    }

    /**
     * Enriches {@param cells} in place
     * @return errors of failed sources, keyed by source name
     */
    public List<Pair<String, Throwable>> run(TrackedCellCollection cells) {
        List<Task> tasks = enrichers.stream().map(e -> new Task(e, cells.duplicate())).collect(Collectors.toList());
        List<Pair<String, Throwable>> errors = ThreadRunner.execute(tasks, numThreads, (t, idx) -> {
            try {
                t.enricher.enrich(t.copy);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        Map<String, Throwable> errorMap = new HashMap<>();
        for (Pair<String, Throwable> e : errors) errorMap.put(e.key, e.value);
        for (Task t : tasks) {
            Throwable error = errorMap.get(t.enricher.getName());
            if (error==null) {
                int count = mergeFields(t.copy, cells, t.enricher.getFields());
                logger.debug("{}: {} field value(s) merged", t.enricher.getName(), count);
            } else {
                EnrichmentField.Sentinel sentinel = error instanceof UncheckedIOException ? EnrichmentField.Sentinel.DATASET_LOAD_ERROR : EnrichmentField.Sentinel.PROCESSING_ERROR;
                logger.warn("enrichment source {} unavailable: {}", t.enricher.getName(), error.toString());
                setSentinel(cells, t.enricher.getFields(), sentinel);
            }
        }
        return errors;
    }

    /**
     * Same as {@link #run(TrackedCellCollection)}, then throws a {@link MultipleException} if a source failed.
     * Sentinels of failed sources are set before the exception is thrown
     */
    public void runAndThrowErrors(TrackedCellCollection cells) {
        List<Pair<String, Throwable>> errors = run(cells);
        if (!errors.isEmpty()) throw new MultipleException(errors);
    }

    /**
     * Copies values of {@param fields} from snapshots of {@param source} to the snapshots of {@param target} with same track id and timestamp
     * @return number of copied values
     */
    public static int mergeFields(TrackedCellCollection source, TrackedCellCollection target, Set<EnrichmentField> fields) {
        int count = 0;
        for (TrackedCell sourceCell : source.getCells()) {
            TrackedCell targetCell = target.get(sourceCell.getId());
            if (targetCell==null) continue;
            for (HistorySnapshot s : sourceCell.getHistory()) {
                HistorySnapshot t = targetCell.getSnapshot(s.getTimestamp());
                if (t==null) continue;
                for (EnrichmentField f : fields) {
                    if (s.getExtraFields().containsKey(f.key)) {
                        t.setExtraField(f.key, s.getExtraField(f.key));
                        ++count;
                    }
                }
            }
        }
        return count;
    }

    public static void setSentinel(TrackedCellCollection cells, Set<EnrichmentField> fields, EnrichmentField.Sentinel sentinel) {
        cells.stream().map(TrackedCell::getLastSnapshot).filter(s -> s!=null).forEach(s -> {
            for (EnrichmentField f : fields) if (f.required) s.setExtraField(f.key, sentinel.value);
        });
    }
}
