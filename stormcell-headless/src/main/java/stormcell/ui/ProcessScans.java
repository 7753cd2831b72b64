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
package stormcell.ui;

import stormcell.configuration.TrackingConfiguration;
import stormcell.core.JSONGridSource;
import stormcell.core.JSONTrackedCellStore;
import stormcell.core.ScanReport;
import stormcell.core.TrackingPipeline;
import stormcell.data_structure.TrackedCellCollection;
import stormcell.image.ReflectivityGrid;
import stormcell.utils.TimestampUtils;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.json.simple.parser.ParseException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Command line runner: updates a tracked cell file with one or several scans.
 * <pre>ProcessScans &lt;tracked.json&gt; &lt;grid.json&gt;... [--config cfg.json] [--log-level LEVEL]</pre>
 * @author Jean Ollion
 */
public class ProcessScans {
    static final org.slf4j.Logger logger = LoggerFactory.getLogger(ProcessScans.class);
    static final String USAGE = "Usage: ProcessScans <tracked.json> <grid.json>... [--config cfg.json] [--log-level LEVEL]";

    public static void main(String[] args) {
        Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.INFO);
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println(e.getMessage());
            System.out.println(USAGE);
            System.exit(1);
            return;
        }
        if (arguments.logLevel!=null) root.setLevel(Level.toLevel(arguments.logLevel, Level.INFO));
        try {
            List<ScanReport> reports = run(arguments);
            System.out.println(reports.size()+" scan(s) processed");
            for (ScanReport r : reports) System.out.println(r);
        } catch (IOException | ParseException | RuntimeException e) {
            logger.error("processing failed", e);
            System.exit(2);
        }
    }

    static class Arguments {
        Path trackedFile;
        final List<Path> gridFiles = new ArrayList<>();
        Path configFile;
        String logLevel;

        static Arguments parse(String[] args) {
            Arguments res = new Arguments();
            List<String> positional = new ArrayList<>();
            for (int i = 0; i<args.length; ++i) {
                switch (args[i]) {
                    case "--config":
                        if (i+1>=args.length) throw new IllegalArgumentException("Missing value for --config");
                        res.configFile = Paths.get(args[++i]);
                        break;
                    case "--log-level":
                        if (i+1>=args.length) throw new IllegalArgumentException("Missing value for --log-level");
                        res.logLevel = args[++i];
                        break;
                    default:
                        if (args[i].startsWith("--")) throw new IllegalArgumentException("Unknown option: "+args[i]);
                        positional.add(args[i]);
                }
            }
            if (positional.size()<2) throw new IllegalArgumentException("Missing argument: tracked cell file and at least one grid file");
            res.trackedFile = Paths.get(positional.get(0));
            for (int i = 1; i<positional.size(); ++i) res.gridFiles.add(Paths.get(positional.get(i)));
            return res;
        }
    }

    static List<ScanReport> run(Arguments arguments) throws IOException, ParseException {
        TrackingConfiguration config = arguments.configFile==null ? new TrackingConfiguration() : TrackingConfiguration.load(arguments.configFile);
        TrackingPipeline pipeline = new TrackingPipeline(config);
        JSONTrackedCellStore store = new JSONTrackedCellStore(arguments.trackedFile).setFloatPrecision(config.getFloatPrecision());
        TrackedCellCollection tracked = store.load();
        List<ReflectivityGrid> grids = new ArrayList<>();
        for (Path p : arguments.gridFiles) grids.add(new JSONGridSource(p).setNoDataValue(config.getNoDataValue()).getGrid());
        grids.sort(Comparator.comparing(ReflectivityGrid::getTimestamp, Comparator.nullsLast(TimestampUtils.CHRONOLOGICAL)));
        List<ScanReport> reports = new ArrayList<>();
        for (ReflectivityGrid g : grids) {
            if (g.getTimestamp()==null) throw new IllegalArgumentException("Grid without timestamp: "+g);
            reports.add(pipeline.process(g, tracked));
        }
        store.save(tracked);
        logger.info("{} tracked cells saved to {}", tracked.size(), arguments.trackedFile);
        return reports;
    }
}
