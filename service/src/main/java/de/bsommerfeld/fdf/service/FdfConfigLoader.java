package de.bsommerfeld.fdf.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.fdf.core.config.FdfConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Reads {@link FdfConfig} from a TOML file.
 *
 * <p>
 * The file is looked up in this order: the path given to {@link #load(Path)},
 * the {@value #PROPERTY} system property, the {@value #ENVIRONMENT} environment
 * variable. If none is set, or the file does not exist, the defaults are used.
 */
public class FdfConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FdfConfigLoader.class);

    public static final String PROPERTY = "fdf.config";
    public static final String ENVIRONMENT = "FDF_CONFIG";

    private final ObjectMapper mapper = new TomlMapper();
    private final Function<String, String> environment;

    public FdfConfigLoader() {
        this(System::getenv);
    }

    FdfConfigLoader(Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * @param explicitPath configuration file to use, or {@code null} to look it up
     * @throws ConfigurationException if the file exists but cannot be read
     */
    public FdfConfig load(Path explicitPath) {
        Path path = locate(explicitPath);
        if (path == null) {
            LOG.info("No configuration file given, using defaults");
            return new FdfConfig();
        }
        if (!Files.exists(path)) {
            LOG.info("Configuration file {} does not exist, using defaults", path.toAbsolutePath());
            return new FdfConfig();
        }

        LOG.info("Loading configuration from: {}", path.toAbsolutePath());
        try {
            FdfConfig config = mapper.readValue(path.toFile(), FdfConfig.class);
            return config != null ? config : new FdfConfig();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path.toAbsolutePath(), e);
        }
    }

    private Path locate(Path explicitPath) {
        if (explicitPath != null)
            return explicitPath;
        String property = System.getProperty(PROPERTY);
        if (property != null && !property.isBlank())
            return Path.of(property);
        String variable = environment.apply(ENVIRONMENT);
        if (variable != null && !variable.isBlank())
            return Path.of(variable);
        return null;
    }
}
