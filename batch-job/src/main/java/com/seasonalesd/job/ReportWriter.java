package com.seasonalesd.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Serializes {@link AnomalyReport}s to JSON, one array per job run.
 *
 * <p>
 * Timestamps are written as ISO-8601 strings. The target stream is flushed
 * but never closed, so standard output stays usable.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportWriter {

    private final ObjectWriter writer;

    public ReportWriter(boolean prettyPrint) {
        ObjectMapper mapper = objectMapper();
        this.writer = prettyPrint ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    /**
     * @param reports reports to write
     * @param out     target stream; flushed, not closed
     * @throws IOException if serialization or writing fails
     */
    public void write(List<AnomalyReport> reports, OutputStream out) throws IOException {
        byte[] json = writer.writeValueAsBytes(reports);
        out.write(json);
        out.write('\n');
        out.flush();
    }

    /**
     * @return the mapper used for reports, with Java time support
     */
    static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}
