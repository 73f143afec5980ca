package org.irradcontrol.node.config;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of the process core, read once from {@code irrad.process}.
 *
 * @param bindHost              Interface the channel sockets bind to.
 * @param minPort               Lowest port of the bind range (inclusive).
 * @param maxPort               Highest port of the bind range (exclusive).
 * @param maxTries              Bind attempts before start fails.
 * @param highWaterMark         Queued messages per subscriber before the oldest is dropped.
 * @param internalQueueCapacity Pending messages on the in-process bus.
 * @param commandPoll           Poll timeout of the command socket.
 * @param stopPoll              Granularity at which worker loops observe their stop flag.
 * @param watchInterval         Interval of the thread watcher.
 * @param eventStreamDelay      Sleep of idle event stream receivers.
 * @param shutdownTimeout       How long shutdown waits for worker threads.
 * @param descriptorDir         Directory holding process descriptor files.
 * @param logChannelLevel       Lowest level forwarded to the log channel.
 */
public record ProcessSettings(
    String bindHost,
    int minPort,
    int maxPort,
    int maxTries,
    int highWaterMark,
    int internalQueueCapacity,
    Duration commandPoll,
    Duration stopPoll,
    Duration watchInterval,
    Duration eventStreamDelay,
    Duration shutdownTimeout,
    Path descriptorDir,
    String logChannelLevel) {

    public static final String CONFIG_PATH = "irrad.process";

    /**
     * Reads the settings from the {@code irrad.process} block of a resolved configuration.
     */
    public static ProcessSettings fromConfig(final Config root) {
        final Config c = root.getConfig(CONFIG_PATH);
        return new ProcessSettings(
            c.getString("bind-host"),
            c.getInt("ports.min"),
            c.getInt("ports.max"),
            c.getInt("ports.max-tries"),
            c.getInt("high-water-mark"),
            c.getInt("internal-queue-capacity"),
            c.getDuration("command-poll"),
            c.getDuration("stop-poll"),
            c.getDuration("watch-interval"),
            c.getDuration("event-stream-delay"),
            c.getDuration("shutdown-timeout"),
            Path.of(c.getString("descriptor-dir")),
            c.getString("log-channel-level"));
    }

    public ProcessSettings withDescriptorDir(final Path dir) {
        return new ProcessSettings(bindHost, minPort, maxPort, maxTries, highWaterMark, internalQueueCapacity,
            commandPoll, stopPoll, watchInterval, eventStreamDelay, shutdownTimeout, dir, logChannelLevel);
    }
}
