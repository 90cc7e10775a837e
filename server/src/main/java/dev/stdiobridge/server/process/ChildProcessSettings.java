package dev.stdiobridge.server.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * How to launch and stop the child.
 *
 * @param command argv of the child, program first
 * @param workingDirectory directory to start in, {@code null} for the bridge's own
 * @param environment variables set on top of the inherited environment
 * @param shutdownGracePeriod how long {@link StdioProcess#terminate()} waits before killing
 * @param healthProbe whether to probe the child with an initialize request on start
 * @param healthProbeTimeout how long to wait for the probe response
 */
public record ChildProcessSettings(List<String> command, Path workingDirectory, Map<String, String> environment,
                                   Duration shutdownGracePeriod, boolean healthProbe, Duration healthProbeTimeout) {

    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HEALTH_PROBE_TIMEOUT = Duration.ofSeconds(10);

    public ChildProcessSettings {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Child command must not be empty");
        }
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        shutdownGracePeriod = shutdownGracePeriod == null ? DEFAULT_SHUTDOWN_GRACE_PERIOD : shutdownGracePeriod;
        healthProbeTimeout = healthProbeTimeout == null ? DEFAULT_HEALTH_PROBE_TIMEOUT : healthProbeTimeout;
    }

    public static ChildProcessSettings of(List<String> command) {
        return new ChildProcessSettings(command, null, Map.of(), null, false, null);
    }
}
