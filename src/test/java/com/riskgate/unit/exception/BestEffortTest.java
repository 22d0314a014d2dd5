package com.riskgate.unit.exception;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.riskgate.exception.BestEffort;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

class BestEffortTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(BestEffortTest.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void getOrDefault_returnsValueWhenActionSucceeds() {
        assertThat(BestEffort.getOrDefault(logger, Level.WARN, "op", () -> 7, 0)).isEqualTo(7);
        assertThat(appender.list).isEmpty();
    }

    @Test
    void getOrDefault_returnsFallbackAndLogsAtRequestedLevel() {
        Integer value = BestEffort.getOrDefault(
                logger,
                Level.ERROR,
                "lookup_failed key=x",
                () -> {
                    throw new IOException("disk gone");
                },
                -1);

        assertThat(value).isEqualTo(-1);
        assertThat(appender.list).hasSize(1);
        ILoggingEvent event = appender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(ch.qos.logback.classic.Level.ERROR);
        assertThat(event.getFormattedMessage()).isEqualTo("lookup_failed key=x error=disk gone");
        assertThat(event.getThrowableProxy().getClassName()).isEqualTo(IOException.class.getName());
    }

    @Test
    void run_reportsOutcome() {
        assertThat(BestEffort.run(logger, Level.WARN, "noop", () -> {})).isTrue();
        assertThat(BestEffort.run(logger, Level.WARN, "boom", () -> {
                    throw new IllegalStateException();
                }))
                .isFalse();
        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(ch.qos.logback.classic.Level.WARN);
            assertThat(event.getFormattedMessage()).isEqualTo("boom error=null");
        });
    }
}
