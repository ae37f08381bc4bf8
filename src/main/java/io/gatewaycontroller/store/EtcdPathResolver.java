package io.gatewaycontroller.store;

import java.nio.file.Paths;
import java.util.Optional;

import static io.gatewaycontroller.config.Constants.*;

/**
 * Resolves etcd keys for gateway status objects.
 * Objects live under {@code <root>/gateways/<namespace>/<name>}; the part after the
 * gateways prefix is the object identity.
 */
public class EtcdPathResolver {

    private final String rootPath;

    public EtcdPathResolver(String rootPath) {
        if (rootPath == null || rootPath.isBlank()) {
            throw new IllegalArgumentException("Gateway root path cannot be empty");
        }
        this.rootPath = rootPath.startsWith(PATH_DELIMITER) ? rootPath : PATH_DELIMITER + rootPath;
    }

    // =================================================================
    // GATEWAY PATHS
    // =================================================================

    /**
     * Get prefix for all gateway status objects, always ending with a delimiter
     * Pattern: /<root>/gateways/
     */
    public String getGatewaysPrefix() {
        return Paths.get(rootPath, PATH_GATEWAYS).toString() + PATH_DELIMITER;
    }

    /**
     * Extract the object identity from a full etcd key.
     * Empty if the key is outside the gateways prefix or names nothing.
     */
    public Optional<String> extractGatewayKey(String path) {
        String prefix = getGatewaysPrefix();
        if (path == null || !path.startsWith(prefix) || path.length() == prefix.length()) {
            return Optional.empty();
        }
        return Optional.of(path.substring(prefix.length()));
    }
}
