package io.surfworks.hpcrunner.exec;

import io.surfworks.hpcrunner.config.SshConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs scheduler commands on a remote head node over SSH.
 *
 * <p>Every command is wrapped as
 * {@code ssh -o ConnectTimeout=N -o BatchMode=yes [-i key] user@host '<cmd>'}
 * and handed to a delegate executor, so the backends stay unaware of where
 * the scheduler actually lives.
 */
public final class SshCommandExecutor implements CommandExecutor {

    private final SshConfig config;
    private final CommandExecutor delegate;

    public SshCommandExecutor(SshConfig config) {
        this(config, new ProcessCommandExecutor());
    }

    public SshCommandExecutor(SshConfig config, CommandExecutor delegate) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
    }

    @Override
    public CommandResult run(List<String> command, String stdin, Duration timeout) throws CommandException {
        CommandResult remote = delegate.run(wrap(command, false), stdin, timeout);
        // Report the remote command line, not the ssh wrapper
        return new CommandResult(command, remote.exitCode(), remote.stdout(), remote.stderr());
    }

    @Override
    public int runInteractive(List<String> command, Path workDir) throws CommandException {
        List<String> remote = new ArrayList<>(command.size() + 2);
        if (workDir != null) {
            remote.add("cd " + quote(workDir.toString()) + " &&");
        }
        remote.addAll(command);
        return delegate.runInteractive(wrap(remote, true), null);
    }

    /**
     * Builds the local ssh invocation for a remote command.
     *
     * @param command Remote program and arguments
     * @param tty     Whether to request a terminal (interactive sessions)
     */
    List<String> wrap(List<String> command, boolean tty) {
        List<String> cmd = new ArrayList<>();
        cmd.add("ssh");
        cmd.add("-o");
        cmd.add("ConnectTimeout=" + config.connectTimeoutSeconds());
        cmd.add("-o");
        cmd.add("BatchMode=yes");
        if (tty) {
            cmd.add("-t");
        }
        if (config.keyPath() != null) {
            cmd.add("-i");
            cmd.add(config.keyPath().toString());
        }
        cmd.add(config.target());
        cmd.add(toRemoteCommandLine(command));
        return cmd;
    }

    static String toRemoteCommandLine(List<String> command) {
        StringBuilder sb = new StringBuilder();
        for (String arg : command) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            // "cd dir &&" prefixes are already shell syntax
            sb.append(arg.endsWith(" &&") ? arg : quote(arg));
        }
        return sb.toString();
    }

    static String quote(String arg) {
        if (!arg.isEmpty() && arg.matches("[A-Za-z0-9_@%+=:,./-]+")) {
            return arg;
        }
        return "'" + arg.replace("'", "'\\''") + "'";
    }
}
