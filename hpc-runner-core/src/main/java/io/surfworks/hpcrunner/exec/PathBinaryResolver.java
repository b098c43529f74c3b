package io.surfworks.hpcrunner.exec;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves executables against the directories of a {@code PATH}-style search list.
 */
public final class PathBinaryResolver implements BinaryResolver {

    private static final Logger LOG = Logger.getLogger(PathBinaryResolver.class.getName());

    private final List<Path> directories;

    /**
     * Creates a resolver over the current process's {@code PATH}.
     */
    public PathBinaryResolver() {
        this(System.getenv("PATH"));
    }

    /**
     * Creates a resolver over an explicit search path.
     *
     * @param searchPath Directories separated by {@link File#pathSeparator}, may be null
     */
    public PathBinaryResolver(String searchPath) {
        List<Path> dirs = new ArrayList<>();
        if (searchPath != null) {
            for (String entry : searchPath.split(File.pathSeparator)) {
                if (entry.isBlank()) continue;
                try {
                    dirs.add(Path.of(entry));
                } catch (InvalidPathException e) {
                    LOG.fine(() -> "Ignoring unusable PATH entry: " + entry);
                }
            }
        }
        this.directories = List.copyOf(dirs);
    }

    @Override
    public Optional<Path> find(String name) {
        for (Path dir : directories) {
            Path candidate = dir.resolve(name);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
