package com.seasonalesd.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.seasonalesd.core.model.AnomalyResult;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of running one detection profile over a series.
 *
 * <p>
 * Serialized to JSON by {@link ReportWriter}. Example:
 * </p>
 *
 * <pre>
 * {
 *   "profile" : "daily_clicks",
 *   "seriesLength" : 30,
 *   "detectedAt" : "2024-03-01T08:00:00Z",
 *   "anomalies" : [ { "index" : 29, "value" : 587811.0, "expectedValue" : 851873.0 } ]
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "profile", "seriesLength", "detectedAt", "anomalies" })
public class AnomalyReport implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Name of the detection profile that produced the report. */
    private String profile;

    /** Number of observations in the analysed series. */
    private int seriesLength;

    /** When detection finished. */
    private Instant detectedAt;

    /** One entry per anomaly, ascending by index. */
    private List<Entry> anomalies = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public AnomalyReport() {
    }

    /**
     * Pair every reported index with its observation.
     *
     * @param profile    profile name
     * @param series     the analysed series
     * @param result     detector output for {@code series}
     * @param detectedAt report timestamp
     * @return a new report
     */
    public static AnomalyReport of(String profile, double[] series, AnomalyResult result, Instant detectedAt) {
        AnomalyReport report = new AnomalyReport();
        report.profile = Objects.requireNonNull(profile, "profile must not be null");
        report.detectedAt = Objects.requireNonNull(detectedAt, "detectedAt must not be null");
        report.seriesLength = series.length;

        List<Integer> indices = result.getIndices();
        for (int i = 0; i < indices.size(); i++) {
            int index = indices.get(i);
            Double expected = result.hasExpectedValues() ? result.getExpectedValues().get(i) : null;
            report.anomalies.add(new Entry(index, series[index], expected));
        }
        return report;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = profile;
    }

    public int getSeriesLength() {
        return seriesLength;
    }

    public void setSeriesLength(int seriesLength) {
        this.seriesLength = seriesLength;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(Instant detectedAt) {
        this.detectedAt = detectedAt;
    }

    public List<Entry> getAnomalies() {
        return Collections.unmodifiableList(anomalies);
    }

    public void setAnomalies(List<Entry> anomalies) {
        this.anomalies = anomalies != null ? new ArrayList<>(anomalies) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyReport that))
            return false;
        return seriesLength == that.seriesLength
                && Objects.equals(profile, that.profile)
                && Objects.equals(detectedAt, that.detectedAt)
                && Objects.equals(anomalies, that.anomalies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(profile, seriesLength, detectedAt, anomalies);
    }

    @Override
    public String toString() {
        return "AnomalyReport{" +
                "profile='" + profile + '\'' +
                ", seriesLength=" + seriesLength +
                ", detectedAt=" + detectedAt +
                ", anomalies=" + anomalies.size() +
                '}';
    }

    // ---------------------------------------------------------------
    // Entry
    // ---------------------------------------------------------------

    /**
     * A single anomalous observation. {@code expectedValue} is omitted from
     * the JSON when the profile did not request expected values.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "index", "value", "expectedValue" })
    public static class Entry implements Serializable {

        private static final long serialVersionUID = 1L;

        private int index;
        private double value;
        private Double expectedValue;

        /** No-arg constructor required by Jackson. */
        public Entry() {
        }

        public Entry(int index, double value, Double expectedValue) {
            this.index = index;
            this.value = value;
            this.expectedValue = expectedValue;
        }

        public int getIndex() {
            return index;
        }

        public void setIndex(int index) {
            this.index = index;
        }

        public double getValue() {
            return value;
        }

        public void setValue(double value) {
            this.value = value;
        }

        public Double getExpectedValue() {
            return expectedValue;
        }

        public void setExpectedValue(Double expectedValue) {
            this.expectedValue = expectedValue;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Entry that))
                return false;
            return index == that.index
                    && Double.compare(value, that.value) == 0
                    && Objects.equals(expectedValue, that.expectedValue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(index, value, expectedValue);
        }

        @Override
        public String toString() {
            return "Entry{index=" + index + ", value=" + value + ", expectedValue=" + expectedValue + '}';
        }
    }
}
