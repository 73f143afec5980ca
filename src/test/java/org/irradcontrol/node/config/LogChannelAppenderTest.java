package org.irradcontrol.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.irradcontrol.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogChannelAppenderTest {

    private final List<String> records = new CopyOnWriteArrayList<>();
    private Logger logger;
    private LogChannelAppender appender;

    @BeforeEach
    void setUp() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        logger = context.getLogger("org.irradcontrol.node.config.ChannelProbe");
        logger.setLevel(Level.DEBUG);
        appender = new LogChannelAppender(record -> {
            records.add(record);
            // Logged from inside the sink; must not loop back into the channel.
            logger.info("forwarded {}", records.size());
        }, Level.INFO);
        appender.setContext(context);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        appender.stop();
        logger.setLevel(null);
    }

    @Test
    void append_rendersLevelShortLoggerAndMessage() {
        logger.info("Row {} of scan {} started", 2, 0);

        assertThat(records).containsExactly("INFO ChannelProbe: Row 2 of scan 0 started");
    }

    @Test
    void append_dropsEventsBelowThreshold() {
        logger.debug("not forwarded");
        logger.info("forwarded");

        assertThat(records).containsExactly("INFO ChannelProbe: forwarded");
    }
}
