package io.surfworks.hpcrunner.exec;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates executables by name.
 */
@FunctionalInterface
public interface BinaryResolver {

    /**
     * Returns the path of the named executable, or empty if it cannot be found.
     */
    Optional<Path> find(String name);

    /**
     * Returns true if the named executable can be found.
     */
    default boolean isAvailable(String name) {
        return find(name).isPresent();
    }
}
