package com.rechargeengine.core.config;

import com.rechargeengine.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads recharge {@link CalculationParameters} from YAML.
 *
 * <p>
 * The file mirrors the bean properties of {@link CalculationParameters}, one
 * top-level key per parameter ({@code specificYield: 0.2},
 * {@code curveType: POWER}, ...). Omitted keys keep their built-in defaults,
 * so a site file only needs the values that differ from
 * {@value #DEFAULT_RESOURCE}. A misspelled or repeated key fails the load
 * instead of being silently ignored, and the result always passes
 * {@link CalculationParameters#validate()}.
 * </p>
 *
 * <p>
 * {@link #load()} prefers the file named by {@value #ENV_PARAMETERS_PATH} and
 * otherwise reads the bundled defaults.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParametersLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ParametersLoader.class);

    /** Points at a site-specific parameter file. */
    public static final String ENV_PARAMETERS_PATH = "RECHARGE_PARAMETERS_PATH";

    /** Bundled parameter file holding the engine defaults. */
    public static final String DEFAULT_RESOURCE = "recharge.yml";

    private ParametersLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Parameters for this run: the site file when the environment names one
     * that exists, the bundled defaults otherwise.
     *
     * @return validated parameters
     * @throws ValidationException if a parameter is invalid
     */
    public static CalculationParameters load() {
        String sitePath = System.getenv(ENV_PARAMETERS_PATH);
        if (sitePath != null && !sitePath.isBlank() && Files.exists(Path.of(sitePath))) {
            LOG.info("Using site recharge parameters from {}", sitePath);
            return fromFile(sitePath);
        }
        LOG.info("Using bundled recharge parameters {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file on disk
     * @return validated parameters
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    on an I/O failure while reading
     * @throws ValidationException      if the YAML does not describe valid
     *                                  parameters
     */
    public static CalculationParameters fromFile(String path) {
        Objects.requireNonNull(path, "Parameters file path must not be null");
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            return read(in, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Parameters file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read parameters file: " + path, e);
        }
    }

    /**
     * @param resource resource name on the classpath, e.g. {@value #DEFAULT_RESOURCE}
     * @return validated parameters
     * @throws IllegalArgumentException if there is no such resource
     * @throws ValidationException      if the YAML does not describe valid
     *                                  parameters
     */
    public static CalculationParameters fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = ParametersLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (in) {
            return read(in, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static CalculationParameters read(InputStream in, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(CalculationParameters.class, options));

        CalculationParameters parameters;
        try {
            parameters = yaml.load(in);
        } catch (YAMLException e) {
            throw new ValidationException("Malformed parameters in " + source + ": " + e.getMessage());
        }

        if (parameters == null) {
            LOG.warn("{} holds no parameters; falling back to defaults", source);
            parameters = new CalculationParameters();
        }
        parameters.validate();

        LOG.info("Recharge parameters from {}: {}", source, parameters);
        return parameters;
    }
}
