package de.anton.pl.analyser.pl_analyzer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingBridgeTest {

    private static final String POI_LOGGER = "org.apache.poi.ss.usermodel.WorkbookFactory";

    private Logger target;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUpAppender() {
        target = (Logger) LoggerFactory.getLogger(POI_LOGGER);
        appender = new ListAppender<>();
        appender.start();
        target.addAppender(appender);
        target.setLevel(Level.INFO);
    }

    @AfterEach
    void tearDownAppender() {
        target.detachAppender(appender);
        target.setLevel(null);
    }

    @Test
    void shouldRouteLog4jApiCallsIntoLogback() {
        LogManager.getLogger(POI_LOGGER).warn("Workbook {} could not be parsed", "broken.xlsx");

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Workbook broken.xlsx could not be parsed");
        assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.WARN);
    }
}
