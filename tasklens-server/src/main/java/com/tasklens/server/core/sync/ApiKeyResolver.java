package com.tasklens.server.core.sync;

import com.tasklens.server.config.TaskLensProperties;
import com.tasklens.server.core.util.HomePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the context service API key. Looked up in order: the environment variable, the explicit
 * key, then an {@code api_key = "..."} line in the config file.
 */
@Slf4j
@Component
public class ApiKeyResolver {

    private static final Pattern API_KEY_LINE =
            Pattern.compile("^\\s*api_key\\s*=\\s*[\"']([^\"']+)[\"']", Pattern.MULTILINE);

    private final String envName;
    private final Path configFile;
    private final UnaryOperator<String> environment;

    @Autowired
    public ApiKeyResolver(TaskLensProperties properties) {
        this(properties, System::getenv);
    }

    ApiKeyResolver(TaskLensProperties properties, UnaryOperator<String> environment) {
        this.envName = properties.getSync().getApiKeyEnv();
        this.configFile = HomePaths.resolve(properties.getSync().getConfigFile());
        this.environment = environment;
    }

    /**
     * @throws SyncConfigurationException when no source provides a key
     */
    public String resolve(String explicitKey) {
        String fromEnv = trimToNull(envName == null ? null : environment.apply(envName));
        if (fromEnv != null) {
            return fromEnv;
        }
        String explicit = trimToNull(explicitKey);
        if (explicit != null) {
            return explicit;
        }
        String fromFile = readConfigFile();
        if (fromFile != null) {
            return fromFile;
        }
        throw new SyncConfigurationException(("Missing API key. Set %s, configure tasklens.sync.api-key, "
                + "or add api_key to %s.").formatted(envName, configFile));
    }

    private String readConfigFile() {
        if (!Files.isRegularFile(configFile)) {
            return null;
        }
        try {
            Matcher matcher = API_KEY_LINE.matcher(Files.readString(configFile, StandardCharsets.UTF_8));
            return matcher.find() ? trimToNull(matcher.group(1)) : null;
        } catch (IOException e) {
            log.debug("Unable to read {}: {}", configFile, e.getMessage());
            return null;
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
