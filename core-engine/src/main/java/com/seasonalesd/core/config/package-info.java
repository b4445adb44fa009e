/**
 * YAML loading and validation of detection profiles.
 *
 * <p>
 * {@link com.seasonalesd.core.config.ProfilesLoader} parses a
 * {@link com.seasonalesd.core.config.ProfilesConfig} with SnakeYAML and
 * validates it immediately.
 * </p>
 *
 * @since 1.0.0
 */
package com.seasonalesd.core.config;
