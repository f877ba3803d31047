package fr.lapetina.consensus.orchestrator.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the orchestrator YAML into an {@link OrchestratorConfig}.
 *
 * The location is tried as a file path, then as a classpath resource.
 * An empty document yields the defaults.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final String location;
    private final Yaml yaml;

    public ConfigLoader(String location) {
        this.location = location;
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, new LoaderOptions()));
    }

    /**
     * @throws ConfigurationException if the location resolves to nothing or the YAML is invalid
     */
    public OrchestratorConfig load() {
        Optional<InputStream> source = openFile().or(this::openResource);
        if (source.isEmpty()) {
            throw new ConfigurationException("Configuration file not found: " + location);
        }
        try (InputStream in = source.get()) {
            return parse(in, location);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read orchestrator configuration " + location, e);
        }
    }

    public OrchestratorConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private Optional<InputStream> openFile() {
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        log.info("Reading orchestrator configuration from file {}", path.toAbsolutePath());
        try {
            return Optional.of(Files.newInputStream(path));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot open orchestrator configuration " + path, e);
        }
    }

    private Optional<InputStream> openResource() {
        String resource = location.replace('\\', '/');
        while (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in != null) {
            log.info("Reading orchestrator configuration from classpath resource {}", resource);
        }
        return Optional.ofNullable(in);
    }

    private OrchestratorConfig parse(InputStream in, String origin) {
        try {
            OrchestratorConfig parsed = yaml.load(in);
            if (parsed == null) {
                log.warn("Configuration {} is empty, using defaults", origin);
                return createDefault();
            }
            return parsed;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    public static OrchestratorConfig createDefault() {
        return new OrchestratorConfig();
    }

    /**
     * Raised when the orchestrator configuration cannot be located or parsed.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
