package org.irradcontrol.cli.commands;

import org.irradcontrol.node.ProcessCore;
import org.irradcontrol.node.config.ProcessSettings;
import org.irradcontrol.node.discovery.DescriptorFile;
import org.irradcontrol.node.spi.IRoleHandler;
import org.irradcontrol.protocol.ProcessDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs a role in the foreground after dealing with an orphaned previous instance.
 */
public final class ProcessLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessLauncher.class);

    /**
     * What to do about a previous instance of the role that is still running.
     */
    public enum OrphanPolicy {
        ASK,
        KILL,
        IGNORE
    }

    private final ProcessSettings settings;
    private final OrphanPolicy policy;
    private final BufferedReader input;
    private final PrintStream output;

    public ProcessLauncher(final ProcessSettings settings, final OrphanPolicy policy) {
        this(settings, policy, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ProcessLauncher(final ProcessSettings settings, final OrphanPolicy policy,
                           final BufferedReader input, final PrintStream output) {
        this.settings = settings;
        this.policy = policy;
        this.input = input;
        this.output = output;
    }

    /**
     * Runs the role until it shuts down.
     *
     * @return Process exit code.
     */
    public int run(final IRoleHandler role) throws InterruptedException {
        resolveOrphan(new DescriptorFile(settings.descriptorDir(), role.roleName()));
        final ProcessCore core = new ProcessCore(role, settings);
        try {
            core.run();
        } catch (RuntimeException e) {
            LOGGER.error("{} terminated: {}", role.roleName(), e.getMessage());
            return 1;
        }
        return 0;
    }

    /**
     * Kills or keeps a live previous instance according to the policy.
     *
     * @return {@code true} if no orphan is running anymore.
     */
    public boolean resolveOrphan(final DescriptorFile descriptorFile) throws InterruptedException {
        final Optional<ProcessDescriptor> orphan = descriptorFile.findOrphan();
        if (orphan.isEmpty()) {
            return true;
        }
        final ProcessDescriptor found = orphan.get();
        final boolean kill = switch (policy) {
            case KILL -> true;
            case IGNORE -> false;
            case ASK -> ask(found);
        };
        if (kill) {
            return descriptorFile.killOrphan(found, Duration.ofSeconds(5));
        }
        LOGGER.warn("Starting although orphaned {} process with pid {} is still running", found.name(), found.pid());
        return false;
    }

    private boolean ask(final ProcessDescriptor orphan) {
        output.printf("An orphaned %s process (pid %d) is still running. Kill it? [y/N] ", orphan.name(), orphan.pid());
        output.flush();
        try {
            final String answer = input.readLine();
            return answer != null && answer.trim().toLowerCase().startsWith("y");
        } catch (IOException e) {
            LOGGER.warn("Could not read answer: {}", e.getMessage());
            return false;
        }
    }
}
