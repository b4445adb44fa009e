/**
 * Batch job that runs Seasonal Hybrid ESD over a series file.
 *
 * <p>
 * This package wires the core detection engine into a one-shot command:
 * read a series, run every configured detection profile and publish a JSON
 * report to a file or standard output.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.seasonalesd.job.SeriesDetectionJob} — main entry point</li>
 * <li>{@link com.seasonalesd.job.JobConfig} — environment-driven
 * configuration</li>
 * <li>{@link com.seasonalesd.job.SeriesReader} — line-oriented series
 * input</li>
 * <li>{@link com.seasonalesd.job.ReportWriter} — JSON report output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seasonalesd.job;
