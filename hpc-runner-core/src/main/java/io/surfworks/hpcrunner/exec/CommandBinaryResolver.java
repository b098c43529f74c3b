package io.surfworks.hpcrunner.exec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves executables by running {@code which} through a {@link CommandExecutor}.
 *
 * <p>Used when scheduler commands run on a remote head node, where the local
 * {@code PATH} says nothing about what is installed. Answers are cached.
 */
public final class CommandBinaryResolver implements BinaryResolver {

    private static final Logger LOG = Logger.getLogger(CommandBinaryResolver.class.getName());
    private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(10);

    private final CommandExecutor executor;
    private final Map<String, Optional<Path>> cache = new ConcurrentHashMap<>();

    public CommandBinaryResolver(CommandExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    @Override
    public Optional<Path> find(String name) {
        return cache.computeIfAbsent(name, this::lookup);
    }

    private Optional<Path> lookup(String name) {
        try {
            CommandResult result = executor.run(List.of("which", name), null, LOOKUP_TIMEOUT);
            String output = result.stdout().strip();
            if (result.isSuccess() && !output.isEmpty()) {
                return Optional.of(Path.of(output.split("\n")[0].strip()));
            }
        } catch (CommandException e) {
            LOG.log(Level.FINE, "Could not look up " + name, e);
        }
        return Optional.empty();
    }
}
