package com.seasonalesd.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link ProfilesConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_PROFILES_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code from*} method validates the parsed profiles, so a bad
 * configuration fails at startup rather than on the first series.
 * </p>
 *
 * @since 1.0.0
 */
public final class ProfilesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ProfilesLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_PROFILES_PATH = "PROFILES_CONFIG_PATH";

    /** Classpath resource used when nothing else is configured. */
    public static final String DEFAULT_RESOURCE = "profiles.yml";

    private ProfilesLoader() {
        // utility class — not instantiable
    }

    /**
     * Load profiles from {@value #ENV_PROFILES_PATH} if it names an existing
     * file, otherwise from {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated profiles
     * @throws IllegalStateException if profile validation fails
     */
    public static ProfilesConfig load() {
        String envPath = System.getenv(ENV_PROFILES_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading profiles from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading profiles from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file path; must not be {@code null}
     * @return parsed and validated profiles
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static ProfilesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Profiles file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Profiles file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read profiles file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated profiles
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static ProfilesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ProfilesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ProfilesConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ProfilesConfig.class, options));
        ProfilesConfig config = yaml.load(is);

        if (config == null || config.getProfiles().isEmpty()) {
            LOG.warn("No detection profiles defined in configuration");
            config = new ProfilesConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} detection profile(s)", config.getProfiles().size());
        return config;
    }
}
