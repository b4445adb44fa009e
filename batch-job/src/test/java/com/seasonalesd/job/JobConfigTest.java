package com.seasonalesd.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults for optional settings")
    void shouldApplyDefaults() {
        JobConfig config = new JobConfig.Builder().seriesPath("/data/clicks.txt").build();

        assertThat(config.getSeriesPath()).isEqualTo("/data/clicks.txt");
        assertThat(config.getProfilesConfigPath()).isEmpty();
        assertThat(config.getReportPath()).isEmpty();
        assertThat(config.isPrettyPrint()).isFalse();
        assertThat(config.toString()).contains("seriesPath='/data/clicks.txt'");
    }

    @Test
    @DisplayName("Should keep every configured value")
    void shouldKeepValues() {
        JobConfig config = new JobConfig.Builder()
                .seriesPath("series.txt")
                .profilesConfigPath("profiles.yml")
                .reportPath("report.json")
                .prettyPrint(true)
                .build();

        assertThat(config.getProfilesConfigPath()).isEqualTo("profiles.yml");
        assertThat(config.getReportPath()).isEqualTo("report.json");
        assertThat(config.isPrettyPrint()).isTrue();
    }

    @Test
    @DisplayName("Should require a series path")
    void shouldRequireSeriesPath() {
        assertThatThrownBy(() -> new JobConfig.Builder().build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(JobConfig.ENV_SERIES_PATH);
        assertThatThrownBy(() -> new JobConfig.Builder().seriesPath("  ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject null optional paths")
    void shouldRejectNullPaths() {
        assertThatThrownBy(() -> new JobConfig.Builder().seriesPath("s").reportPath(null).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("reportPath");
    }
}
