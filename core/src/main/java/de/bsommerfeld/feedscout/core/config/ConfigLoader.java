package de.bsommerfeld.feedscout.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link GlobalConfig} as TOML.
 *
 * <p>
 * A missing file is not an error: the defaults are written to the given path
 * so the user has a complete file to edit, and the defaults are returned.
 * Unknown keys are ignored so that older binaries can read newer files.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}, creating it with defaults if
     * it does not exist yet.
     *
     * @throws IOException if the file exists but cannot be read or parsed, or
     *                     if the defaults cannot be written
     */
    public static GlobalConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, writing defaults.", path);
            GlobalConfig defaults = new GlobalConfig();
            save(defaults, path);
            return defaults;
        }
        GlobalConfig config = MAPPER.readValue(path.toFile(), GlobalConfig.class);
        LOG.debug("Configuration loaded from {}", path);
        return config;
    }

    public static void save(GlobalConfig config, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
    }
}
