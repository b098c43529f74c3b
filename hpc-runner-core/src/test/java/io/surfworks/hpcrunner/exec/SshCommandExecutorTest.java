package io.surfworks.hpcrunner.exec;

import io.surfworks.hpcrunner.config.SshConfig;
import io.surfworks.hpcrunner.testing.FakeCommandExecutor;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SshCommandExecutorTest {

    private final FakeCommandExecutor local = new FakeCommandExecutor();

    @Test
    void wrapsCommandInSsh() throws CommandException {
        local.respond("ssh", "12345\n");
        SshCommandExecutor ssh = new SshCommandExecutor(SshConfig.of("login.cluster", "alice"), local);

        CommandResult result = ssh.run(List.of("squeue", "-h", "-o", "%i|%j"), null, Duration.ofSeconds(5));

        assertEquals(List.of("ssh", "-o", "ConnectTimeout=10", "-o", "BatchMode=yes",
                "alice@login.cluster", "squeue -h -o '%i|%j'"), local.lastCall().command());
        assertEquals(List.of("squeue", "-h", "-o", "%i|%j"), result.command());
        assertEquals("12345\n", result.stdout());
    }

    @Test
    void passesScriptOnStdin() throws CommandException {
        local.respond("ssh", "Your job 1 (\"x\") has been submitted");
        SshCommandExecutor ssh = new SshCommandExecutor(
                SshConfig.of("head", "bob").withKey(Path.of("/home/bob/.ssh/id_ed25519")), local);

        ssh.run(List.of("qsub", "-N", "x"), "#!/bin/bash\ntrue\n", Duration.ofSeconds(5));

        FakeCommandExecutor.Call call = local.lastCall();
        assertEquals("#!/bin/bash\ntrue\n", call.stdin());
        assertTrue(call.commandLine().contains("-i /home/bob/.ssh/id_ed25519 bob@head"));
    }

    @Test
    void interactiveRunRequestsTerminalAndChangesDirectory() throws CommandException {
        local.respond("ssh", 0, "", "");
        SshCommandExecutor ssh = new SshCommandExecutor(SshConfig.of("head", "bob"), local);

        ssh.runInteractive(List.of("srun", "--pty", "/bin/bash", "-c", "echo hi"), Path.of("/scratch/bob"));

        List<String> cmd = local.lastCall().command();
        assertTrue(cmd.contains("-t"));
        assertEquals("cd /scratch/bob && srun --pty /bin/bash -c 'echo hi'", cmd.get(cmd.size() - 1));
    }

    @Test
    void quotesOnlyWhenNeeded() {
        assertEquals("mem_free=16G", SshCommandExecutor.quote("mem_free=16G"));
        assertEquals("''", SshCommandExecutor.quote(""));
        assertEquals("'a b'", SshCommandExecutor.quote("a b"));
        assertEquals("'it'\\''s'", SshCommandExecutor.quote("it's"));
        assertEquals("'*'", SshCommandExecutor.quote("*"));
    }
}
