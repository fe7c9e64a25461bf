package io.envkeeper.server.driver;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.envkeeper.core.driver.CaptureException;
import io.envkeeper.core.driver.EnvironmentDriver;
import io.envkeeper.core.driver.EnvironmentHandle;
import io.envkeeper.core.driver.HealthStatus;
import io.envkeeper.core.driver.ProbeException;
import io.envkeeper.core.driver.RestoreException;
import io.envkeeper.core.driver.ShutdownException;
import io.envkeeper.core.driver.StartupException;
import io.envkeeper.core.driver.StatePayload;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Built-in driver that keeps a long-lived shell process alive.
 * <p>
 * Start configuration:
 *  - "shell":   shell binary (default /bin/sh)
 *  - "command": command line run by the shell with -c; default keeps an
 *               interactive shell reading its (open, idle) stdin
 *  - "cwd":     working directory (default: the supervisor's)
 *  - "env.X":   environment variable X for the process
 * <p>
 * Captured state is a JSON document of shell, command, cwd and env. Restore
 * relaunches a fresh process from it; in-process memory of the old shell is
 * not carried over.
 */
public final class ShellProcessDriver implements EnvironmentDriver {
    private static final Logger log = Logger.getLogger(ShellProcessDriver.class.getName());
    private static final String ENV_PREFIX = "env.";
    private static final Duration STOP_GRACE = Duration.ofSeconds(2);

    private final ObjectMapper json = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** JSON body of a captured shell state. */
    public static final class ShellState {
        public String shell;
        public String command;
        public String cwd;
        public Map<String, String> env = new TreeMap<>();
        public long pid;
    }

    @Override
    public EnvironmentHandle start(Map<String, String> config) throws StartupException {
        ShellState s = new ShellState();
        s.shell = config.getOrDefault("shell", "/bin/sh");
        s.command = config.getOrDefault("command", "exec " + s.shell);
        s.cwd = config.get("cwd");
        for (Map.Entry<String, String> e : config.entrySet()) {
            if (e.getKey().startsWith(ENV_PREFIX) && e.getKey().length() > ENV_PREFIX.length()) {
                s.env.put(e.getKey().substring(ENV_PREFIX.length()), e.getValue());
            }
        }
        try {
            return launch(s);
        } catch (IOException e) {
            throw new StartupException("failed to launch " + s.shell + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop(EnvironmentHandle handle) throws ShutdownException {
        Process p = shell(handle).process;
        p.destroy();
        try {
            if (!p.waitFor(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warning(() -> "pid " + p.pid() + " ignored SIGTERM, killing");
                p.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            throw new ShutdownException("interrupted while stopping pid " + p.pid(), e);
        }
    }

    @Override
    public StatePayload captureState(EnvironmentHandle handle) throws CaptureException {
        ShellHandle h = shell(handle);
        if (!h.process.isAlive()) {
            throw new CaptureException("shell pid " + h.process.pid() + " exited with " + h.process.exitValue());
        }
        try {
            return new StatePayload(json.writeValueAsBytes(h.state), StatePayload.JSON);
        } catch (IOException e) {
            throw new CaptureException("failed to encode shell state", e);
        }
    }

    @Override
    public EnvironmentHandle restoreState(StatePayload payload) throws RestoreException {
        ShellState s;
        try {
            s = json.readValue(payload.bytes(), ShellState.class);
        } catch (IOException e) {
            throw new RestoreException("not a shell state document", e);
        }
        if (s.shell == null || s.command == null) {
            throw new RestoreException("shell state is missing shell or command");
        }
        try {
            return launch(s);
        } catch (IOException e) {
            throw new RestoreException("failed to relaunch " + s.shell + ": " + e.getMessage(), e);
        }
    }

    @Override
    public HealthStatus healthCheck(EnvironmentHandle handle, Duration timeout) throws ProbeException {
        return shell(handle).process.isAlive() ? HealthStatus.HEALTHY : HealthStatus.UNRESPONSIVE;
    }

    private static ShellHandle launch(ShellState s) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(List.of(s.shell, "-c", s.command))
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD);
        if (s.cwd != null) {
            pb.directory(new File(s.cwd));
        }
        pb.environment().putAll(s.env);
        Process p = pb.start();
        log.info(() -> "launched shell pid " + p.pid() + ": " + s.command);

        ShellState copy = new ShellState();
        copy.shell = s.shell;
        copy.command = s.command;
        copy.cwd = s.cwd;
        copy.env = new TreeMap<>(s.env);
        copy.pid = p.pid();
        return new ShellHandle(p, copy);
    }

    private static ShellHandle shell(EnvironmentHandle handle) {
        if (handle instanceof ShellHandle h) {
            return h;
        }
        throw new IllegalArgumentException("not a shell handle: " + handle.describe());
    }

    /** Live shell process plus the state needed to relaunch it. */
    static final class ShellHandle implements EnvironmentHandle {
        final Process process;
        final ShellState state;

        ShellHandle(Process process, ShellState state) {
            this.process = process;
            this.state = state;
        }

        @Override
        public String describe() {
            return "shell pid=" + process.pid() + " command=" + state.command;
        }
    }
}
