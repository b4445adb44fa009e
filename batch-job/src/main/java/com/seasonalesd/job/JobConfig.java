package com.seasonalesd.job;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the series detection job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a shell or a scheduler.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_SERIES_PATH = "SERIES_PATH";
    public static final String ENV_PROFILES_PATH = "PROFILES_CONFIG_PATH";
    public static final String ENV_REPORT_PATH = "REPORT_PATH";
    public static final String ENV_REPORT_PRETTY = "REPORT_PRETTY";

    // ---------------------------------------------------------------
    // Input
    // ---------------------------------------------------------------
    private final String seriesPath;
    private final String profilesConfigPath;

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------
    private final String reportPath;
    private final boolean prettyPrint;

    private JobConfig(Builder b) {
        this.seriesPath = b.seriesPath;
        this.profilesConfigPath = b.profilesConfigPath;
        this.reportPath = b.reportPath;
        this.prettyPrint = b.prettyPrint;
    }

    // ---------------------------------------------------------------
    // Factory — resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if {@value #ENV_SERIES_PATH} is missing
     */
    public static JobConfig fromEnvironment() {
        return new Builder()
                .seriesPath(env(ENV_SERIES_PATH, ""))
                .profilesConfigPath(env(ENV_PROFILES_PATH, ""))
                .reportPath(env(ENV_REPORT_PATH, ""))
                .prettyPrint(Boolean.parseBoolean(env(ENV_REPORT_PRETTY, "false")))
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSeriesPath() {
        return seriesPath;
    }

    /**
     * @return profiles YAML path, or an empty string to use the default
     *         resolution of {@link com.seasonalesd.core.config.ProfilesLoader}
     */
    public String getProfilesConfigPath() {
        return profilesConfigPath;
    }

    /**
     * @return report file path, or an empty string for standard output
     */
    public String getReportPath() {
        return reportPath;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method requires a non-blank series path; the
     * optional paths default to empty strings.
     * </p>
     */
    public static class Builder {
        private String seriesPath;
        private String profilesConfigPath = "";
        private String reportPath = "";
        private boolean prettyPrint;

        public Builder seriesPath(String v) {
            this.seriesPath = v;
            return this;
        }

        public Builder profilesConfigPath(String v) {
            this.profilesConfigPath = v;
            return this;
        }

        public Builder reportPath(String v) {
            this.reportPath = v;
            return this;
        }

        public Builder prettyPrint(boolean v) {
            this.prettyPrint = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            if (seriesPath == null || seriesPath.isBlank()) {
                throw new IllegalArgumentException(
                        "seriesPath must not be null or blank (set " + ENV_SERIES_PATH + ")");
            }
            Objects.requireNonNull(profilesConfigPath, "profilesConfigPath must not be null");
            Objects.requireNonNull(reportPath, "reportPath must not be null");

            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "seriesPath='" + seriesPath + '\'' +
                ", profilesConfigPath='" + profilesConfigPath + '\'' +
                ", reportPath='" + reportPath + '\'' +
                ", prettyPrint=" + prettyPrint +
                '}';
    }
}
