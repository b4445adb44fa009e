package com.seasonalesd.job;

import com.seasonalesd.core.config.ProfilesConfig;
import com.seasonalesd.core.config.ProfilesLoader;
import com.seasonalesd.core.detection.SeasonalHybridEsd;
import com.seasonalesd.core.model.AnomalyResult;
import com.seasonalesd.core.model.DetectionProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point for the batch anomaly detection job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   series file (one number per line)
 *     → SeriesReader
 *     → SeasonalHybridEsd, once per detection profile
 *     → AnomalyReport per profile
 *     → ReportWriter → JSON (file or stdout)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All job settings are resolved from environment variables via
 * {@link JobConfig}; detection profiles come from YAML via
 * {@link ProfilesLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesDetectionJob {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesDetectionJob.class);

    private final SeasonalHybridEsd detector;
    private final Clock clock;

    public SeriesDetectionJob(SeasonalHybridEsd detector, Clock clock) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting series detection with config: {}", config);

        // 2. Run and report
        try {
            new SeriesDetectionJob(SeasonalHybridEsd.create(), Clock.systemUTC()).run(config);
        } catch (IOException | RuntimeException e) {
            LOG.error("Series detection failed: {}", e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Run every configured profile over the configured series and write the
     * report.
     *
     * @param config job settings
     * @return the reports, one per profile in configuration order
     * @throws IllegalStateException if no profiles are configured
     * @throws IOException           if reading the series or writing the
     *                               report fails
     */
    public List<AnomalyReport> run(JobConfig config) throws IOException {
        List<DetectionProfile> profiles = loadProfiles(config).getProfiles();
        if (profiles.isEmpty()) {
            throw new IllegalStateException(
                    "No detection profiles defined. Provide profiles via "
                            + ProfilesLoader.ENV_PROFILES_PATH
                            + " or a classpath " + ProfilesLoader.DEFAULT_RESOURCE + " file.");
        }

        double[] series = SeriesReader.read(Path.of(config.getSeriesPath()));
        List<AnomalyReport> reports = detectAll(series, profiles);

        writeReports(config, reports);
        return reports;
    }

    /**
     * @param series   observations
     * @param profiles profiles to run, in order
     * @return one report per profile
     */
    List<AnomalyReport> detectAll(double[] series, List<DetectionProfile> profiles) {
        List<AnomalyReport> reports = new ArrayList<>(profiles.size());
        for (DetectionProfile profile : profiles) {
            AnomalyResult result = detector.detect(series, profile);
            LOG.info("Profile '{}' found {} anomaly(ies) in {} observation(s)",
                    profile.getName(), result.size(), series.length);
            reports.add(AnomalyReport.of(profile.getName(), series, result, clock.instant()));
        }
        return reports;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ProfilesConfig loadProfiles(JobConfig config) {
        String profilesPath = config.getProfilesConfigPath();
        if (profilesPath != null && !profilesPath.isBlank()) {
            return ProfilesLoader.fromFile(profilesPath);
        }
        return ProfilesLoader.load();
    }

    private static void writeReports(JobConfig config, List<AnomalyReport> reports) throws IOException {
        ReportWriter writer = new ReportWriter(config.isPrettyPrint());
        String reportPath = config.getReportPath();
        if (reportPath == null || reportPath.isBlank()) {
            writer.write(reports, System.out);
            return;
        }
        try (OutputStream out = Files.newOutputStream(Path.of(reportPath))) {
            writer.write(reports, out);
        }
        LOG.info("Wrote {} report(s) to {}", reports.size(), reportPath);
    }
}
