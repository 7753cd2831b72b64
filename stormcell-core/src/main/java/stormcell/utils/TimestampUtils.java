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
package stormcell.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scan timestamps are ISO-8601 like strings, with or without offset. Timestamps without offset are considered UTC.
 * @author Jean Ollion
 */
public class TimestampUtils {
    public final static Logger logger = LoggerFactory.getLogger(TimestampUtils.class);
    private static final Pattern[] FILENAME_PATTERNS = new Pattern[] {
            Pattern.compile("MRMS_MergedReflectivityQC_3D_(\\d{8})-(\\d{6})"),
            Pattern.compile("(\\d{8})-(\\d{6})_renamed"),
            Pattern.compile("(\\d{8})-(\\d{6})")
    };

    /**
     * @return the instant corresponding to {@param timestamp} or null if it cannot be parsed
     */
    public static Instant parse(String timestamp) {
        if (timestamp==null || timestamp.isEmpty()) return null;
        String t = timestamp.trim().replace(' ', 'T');
        Instant res = tryParse(t, s -> OffsetDateTime.parse(s).toInstant());
        if (res==null) res = tryParse(t, s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC));
        if (res==null) res = tryParse(t, Instant::parse);
        return res;
    }

    private static Instant tryParse(String timestamp, Function<String, Instant> parser) {
        try {
            return parser.apply(timestamp);
        } catch (DateTimeParseException e) {
            logger.trace("timestamp {} not parsed: {}", timestamp, e.getMessage());
            return null;
        }
    }

    /**
     * @return elapsed seconds from {@param t0} to {@param t1}
     * @throws IllegalArgumentException if one timestamp cannot be parsed
     */
    public static double secondsBetween(String t0, String t1) {
        Instant i0 = parse(t0);
        Instant i1 = parse(t1);
        if (i0==null || i1==null) throw new IllegalArgumentException("Unparseable timestamp: "+(i0==null ? t0 : t1));
        return Duration.between(i0, i1).toMillis() / 1000d;
    }

    /**
     * Chronological order when both timestamps are parseable, lexicographic order otherwise
     */
    public static final Comparator<String> CHRONOLOGICAL = (t0, t1) -> {
        Instant i0 = parse(t0);
        Instant i1 = parse(t1);
        if (i0!=null && i1!=null) return i0.compareTo(i1);
        return String.valueOf(t0).compareTo(String.valueOf(t1));
    };

    /**
     * Extract the scan time from a radar file name containing a {@code YYYYMMDD-HHMMSS} pattern
     * @return timestamp formatted as {@code YYYY-MM-DDTHH:MM:SS}, or null if no pattern matches
     */
    public static String extractFromFilename(String filename) {
        if (filename==null) return null;
        for (Pattern p : FILENAME_PATTERNS) {
            Matcher m = p.matcher(filename);
            if (m.find()) {
                String date = m.group(1);
                String time = m.group(2);
                String res = date.substring(0, 4) + "-" + date.substring(4, 6) + "-" + date.substring(6, 8) + "T"
                        + time.substring(0, 2) + ":" + time.substring(2, 4) + ":" + time.substring(4, 6);
                logger.trace("timestamp extracted from {}: {}", filename, res);
                return res;
            }
        }
        return null;
    }
}
