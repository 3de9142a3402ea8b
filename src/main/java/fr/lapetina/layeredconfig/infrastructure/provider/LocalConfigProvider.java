package fr.lapetina.layeredconfig.infrastructure.provider;

import fr.lapetina.layeredconfig.domain.exception.ConfigException;
import fr.lapetina.layeredconfig.domain.model.ConfigErrorType;
import fr.lapetina.layeredconfig.infrastructure.format.ConfigFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Loads configuration from a file, with defaults below and environment above.
 *
 * The format follows the file extension ({@code .yaml}, {@code .yml},
 * {@code .json}, {@code .properties}). A missing file is not an error as
 * long as defaults exist.
 */
public final class LocalConfigProvider extends AbstractConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalConfigProvider.class);

    private final Path path;

    public LocalConfigProvider(ProviderContext context, Path path) {
        super(context);
        this.path = path;
    }

    @Override
    protected Optional<Map<String, Object>> readSource() {
        if (Files.exists(path)) {
            ConfigFormat format = ConfigFormat.fromPath(path)
                    .orElseThrow(() -> new ConfigException(ConfigErrorType.SOURCE_UNPARSABLE,
                            "unsupported config type for file: " + path));
            byte[] content;
            try {
                content = Files.readAllBytes(path);
            } catch (IOException e) {
                throw new ConfigException(ConfigErrorType.SOURCE_UNREADABLE,
                        "error reading config file: " + path, e);
            }
            log.debug("Loading configuration from file: path={}, format={}", path, format);
            return Optional.of(format.decode(content));
        }

        if (!Files.notExists(path)) {
            throw new ConfigException(ConfigErrorType.SOURCE_UNREADABLE,
                    "unable to check config file: " + path);
        }
        if (context.hasDefaults()) {
            log.info("Config file does not exist, using defaults only: {}", path);
            return Optional.empty();
        }
        throw new ConfigException(ConfigErrorType.SOURCE_NOT_FOUND,
                "no configuration file found at " + path + " and no defaults provided");
    }

    @Override
    public String describe() {
        return "file:" + path;
    }
}
