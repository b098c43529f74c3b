package io.surfworks.hpcrunner.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * SSH settings for driving a scheduler on a remote head node.
 *
 * @param host                  SSH hostname of the head node
 * @param user                  SSH username
 * @param keyPath               Path to SSH private key (null = use default)
 * @param connectTimeoutSeconds SSH connection timeout in seconds
 */
public record SshConfig(
        String host,
        String user,
        Path keyPath,
        int connectTimeoutSeconds
) {

    /** Default SSH connection timeout */
    public static final int DEFAULT_CONNECT_TIMEOUT = 10;

    public SshConfig {
        Objects.requireNonNull(host, "host cannot be null");
        Objects.requireNonNull(user, "user cannot be null");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host cannot be blank");
        }
        if (user.isBlank()) {
            throw new IllegalArgumentException("user cannot be blank");
        }
        if (connectTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("connectTimeoutSeconds must be positive");
        }
    }

    /**
     * Creates a config for connecting with the default key and timeout.
     */
    public static SshConfig of(String host, String user) {
        return new SshConfig(host, user, null, DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * Returns a new config with the specified private key.
     */
    public SshConfig withKey(Path keyPath) {
        return new SshConfig(host, user, keyPath, connectTimeoutSeconds);
    }

    /**
     * Returns the SSH connection string (user@host).
     */
    public String target() {
        return user + "@" + host;
    }
}
