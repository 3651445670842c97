package com.watchtower.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link DetectorsConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_DETECTORS_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing, so that invalid
 * detectors stop the application at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_DETECTORS_PATH = "DETECTORS_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "detectors.yml";

    private DetectorsLoader() {
    }

    /**
     * Load detectors from {@value #ENV_DETECTORS_PATH} if it names an
     * existing file, otherwise from {@value #DEFAULT_RESOURCE} on the
     * classpath.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static DetectorsConfig load() {
        return load(System.getenv(ENV_DETECTORS_PATH));
    }

    static DetectorsConfig load(String overridePath) {
        if (overridePath != null && !overridePath.isBlank() && Files.exists(Path.of(overridePath))) {
            LOG.info("Loading detectors from path: {}", overridePath);
            return fromFile(overridePath);
        }
        LOG.info("Loading detectors from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load detectors from a file system path.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectorsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Detectors file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Detectors file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read detectors file: " + path, e);
        }
    }

    /**
     * Load detectors from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectorsConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectorsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static DetectorsConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectorsConfig.class, options));

        DetectorsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detectors configuration in " + source, e);
        }

        if (config == null) {
            LOG.warn("Detectors configuration {} is empty", source);
            config = new DetectorsConfig();
        }
        config.validate();

        LOG.info("Loaded {} detector(s) and {} condition group(s) from {}",
                config.getDetectors().size(), config.getConditionGroups().size(), source);
        return config;
    }
}
