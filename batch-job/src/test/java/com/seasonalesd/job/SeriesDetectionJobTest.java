package com.seasonalesd.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.seasonalesd.core.decomposition.Decomposition;
import com.seasonalesd.core.detection.InvalidDataException;
import com.seasonalesd.core.detection.SeasonalHybridEsd;
import com.seasonalesd.core.model.DetectionProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SeriesDetectionJob}.
 */
class SeriesDetectionJobTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T08:00:00Z"), ZoneOffset.UTC);

    private static final double[] HOLIDAY_CLICKS = {
            534592, 854369, 868702, 852728, 773757, 618216, 423549, 497898, 836237, 883591,
            888337, 818443, 660449, 482778, 477392, 904671, 943225, 918105, 843145, 685644,
            511239, 558484, 894195, 927928, 919406, 852359, 658974, 473478, 458006, 587811 };

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should run every profile and write the report file")
    void shouldRunProfilesAndWriteReport() throws IOException {
        Path series = writeSeries(HOLIDAY_CLICKS);
        Path profiles = dir.resolve("profiles.yml");
        Files.writeString(profiles, String.join("\n",
                "profiles:",
                "  - name: weekly",
                "    period: 7",
                "    expectedValues: true",
                "  - name: weekly_pos_last_day",
                "    period: 7",
                "    direction: pos",
                "    onlyLast: 1",
                ""));
        Path report = dir.resolve("report.json");

        JobConfig config = new JobConfig.Builder()
                .seriesPath(series.toString())
                .profilesConfigPath(profiles.toString())
                .reportPath(report.toString())
                .build();

        List<AnomalyReport> reports = new SeriesDetectionJob(SeasonalHybridEsd.create(), CLOCK).run(config);

        assertThat(reports).extracting(AnomalyReport::getProfile).containsExactly("weekly", "weekly_pos_last_day");
        AnomalyReport weekly = reports.get(0);
        assertThat(weekly.getSeriesLength()).isEqualTo(30);
        assertThat(weekly.getDetectedAt()).isEqualTo(CLOCK.instant());
        assertThat(weekly.getAnomalies()).extracting(AnomalyReport.Entry::getIndex).containsExactly(29);
        assertThat(weekly.getAnomalies().get(0).getValue()).isEqualTo(587811.0);
        assertThat(weekly.getAnomalies().get(0).getExpectedValue()).isNotNull();
        // a holiday dip is not a positive anomaly
        assertThat(reports.get(1).getAnomalies()).isEmpty();

        JsonNode json = ReportWriter.objectMapper().readTree(report.toFile());
        assertThat(json).hasSize(2);
        assertThat(json.get(0).get("anomalies").get(0).get("index").asInt()).isEqualTo(29);
    }

    @Test
    @DisplayName("Should fail when no profiles are defined")
    void shouldFailWithoutProfiles() throws IOException {
        Path profiles = dir.resolve("empty.yml");
        Files.writeString(profiles, "profiles: []\n");
        JobConfig config = new JobConfig.Builder()
                .seriesPath(writeSeries(HOLIDAY_CLICKS).toString())
                .profilesConfigPath(profiles.toString())
                .build();

        assertThatThrownBy(() -> new SeriesDetectionJob(SeasonalHybridEsd.create(), CLOCK).run(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No detection profiles");
    }

    @Test
    @DisplayName("Should surface detector errors for bad data")
    void shouldSurfaceDetectorErrors() throws IOException {
        double[] withNaN = HOLIDAY_CLICKS.clone();
        withNaN[4] = Double.NaN;
        Path profiles = dir.resolve("profiles.yml");
        Files.writeString(profiles, "profiles:\n  - name: weekly\n    period: 7\n");
        Path report = dir.resolve("report.json");
        JobConfig config = new JobConfig.Builder()
                .seriesPath(writeSeries(withNaN).toString())
                .profilesConfigPath(profiles.toString())
                .reportPath(report.toString())
                .build();

        assertThatThrownBy(() -> new SeriesDetectionJob(SeasonalHybridEsd.create(), CLOCK).run(config))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("index 4");
        assertThat(report).doesNotExist();
    }

    @Test
    @DisplayName("Should report each profile in order with the injected detector")
    void shouldDetectWithInjectedDetector() {
        SeasonalHybridEsd detector = SeasonalHybridEsd.builder()
                .decomposer((values, period) -> new Decomposition(new double[values.length], new double[values.length]))
                .build();
        double[] series = new double[28];
        for (int i = 0; i < series.length; i++) {
            series[i] = 100 + (i * 7) % 9 - 4;
        }
        series[20] = 500;

        DetectionProfile flat = DetectionProfile.forPeriod(7);
        flat.setName("flat");
        DetectionProfile negative = DetectionProfile.forPeriod(7);
        negative.setName("negative");
        negative.setDirection("neg");

        List<AnomalyReport> reports = new SeriesDetectionJob(detector, CLOCK)
                .detectAll(series, List.of(flat, negative));

        assertThat(reports).hasSize(2);
        assertThat(reports.get(0).getAnomalies()).extracting(AnomalyReport.Entry::getIndex).contains(20);
        assertThat(reports.get(1).getAnomalies()).extracting(AnomalyReport.Entry::getIndex).doesNotContain(20);
    }

    private Path writeSeries(double[] values) throws IOException {
        Path file = dir.resolve("series.txt");
        String lines = Arrays.stream(values).mapToObj(Double::toString).collect(Collectors.joining("\n"));
        Files.writeString(file, "# daily clicks\n" + lines + "\n");
        return file;
    }
}
