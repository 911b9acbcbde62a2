package com.klinevault.data.cache;

import com.klinevault.core.model.Bar;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV reading and writing for bar files, shared by the cache and the archive source.
 */
public final class BarCsv {

    private BarCsv() {
        // Utility class - prevent instantiation
    }

    /**
     * Read bars until end of input or the integrity footer.
     * A leading header line (any line not starting with a digit) is skipped; blank lines are ignored.
     *
     * @throws IllegalArgumentException if a data line is malformed
     */
    public static List<Bar> read(BufferedReader reader) throws IOException {
        List<Bar> bars = new ArrayList<>();
        String line;
        boolean firstLine = true;

        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.startsWith(IntegrityFooter.PREFIX)) break;

            if (firstLine) {
                firstLine = false;
                if (!Character.isDigit(line.charAt(0))) {
                    continue;
                }
            }
            bars.add(Bar.fromCsv(line));
        }
        return bars;
    }

    /**
     * Header plus one line per bar, each terminated by a newline.
     */
    public static String render(List<Bar> bars) {
        StringBuilder sb = new StringBuilder(Bar.CSV_HEADER.length() + bars.size() * 128);
        sb.append(Bar.CSV_HEADER).append('\n');
        for (Bar bar : bars) {
            sb.append(bar.toCsv()).append('\n');
        }
        return sb.toString();
    }
}
