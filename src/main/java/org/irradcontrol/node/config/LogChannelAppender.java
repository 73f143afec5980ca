package org.irradcontrol.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;

import java.util.function.Consumer;

/**
 * Logback appender that turns log events into log records for the process' {@code log}
 * channel. A record reads {@code "<LEVEL> <logger>: <message>"}.
 */
public final class LogChannelAppender extends AppenderBase<ILoggingEvent> {

    private static final ThreadLocal<Boolean> APPENDING = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final Consumer<String> sink;
    private final Level threshold;

    /**
     * @param sink      Receives each rendered record on the logging thread.
     * @param threshold Events below this level are not forwarded.
     */
    public LogChannelAppender(final Consumer<String> sink, final Level threshold) {
        this.sink = sink;
        this.threshold = threshold;
        setName("log-channel");
    }

    @Override
    protected void append(final ILoggingEvent event) {
        if (!event.getLevel().isGreaterOrEqual(threshold) || APPENDING.get()) {
            return;
        }
        APPENDING.set(Boolean.TRUE);
        try {
            sink.accept(render(event));
        } finally {
            APPENDING.set(Boolean.FALSE);
        }
    }

    static String render(final ILoggingEvent event) {
        final String logger = event.getLoggerName();
        final String shortName = logger.substring(logger.lastIndexOf('.') + 1);
        return event.getLevel() + " " + shortName + ": " + event.getFormattedMessage();
    }
}
