package com.seasonalesd.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * Reads a series of observations, one number per line.
 *
 * <p>
 * Blank lines and lines starting with {@code #} are skipped. {@code NaN}
 * parses; the detector rejects it later with a precise index.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesReader {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesReader.class);

    private SeriesReader() {
        // utility class — not instantiable
    }

    /**
     * @param path series file
     * @return observations in file order
     * @throws IllegalArgumentException if the file is missing or a line is not
     *                                  a number
     * @throws IOException              if reading fails
     */
    public static double[] read(Path path) throws IOException {
        Objects.requireNonNull(path, "Series path must not be null");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            double[] series = parse(reader);
            LOG.info("Read {} observation(s) from {}", series.length, path);
            return series;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Series file not found: " + path, e);
        }
    }

    /**
     * @param source line-oriented input; not closed
     * @return observations in input order
     * @throws IllegalArgumentException if a line is not a number
     * @throws IOException              if reading fails
     */
    public static double[] parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered
                ? buffered
                : new BufferedReader(source);

        double[] values = new double[64];
        int size = 0;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            if (size == values.length) {
                values = Arrays.copyOf(values, size * 2);
            }
            try {
                values[size++] = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid number at line " + lineNumber + ": '" + trimmed + "'", e);
            }
        }
        return Arrays.copyOf(values, size);
    }
}
