package org.eventrouter.destination.log;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.eventrouter.destination.log.TestEvents.eventRecord;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Log destination")
@DisplayNameGeneration(ReplaceUnderscores.class)
class LogDestinationTest {

    private final JacksonEnvelopeCodec codec = new JacksonEnvelopeCodec();
    private final Logger eventsLogger = (Logger) LoggerFactory.getLogger(LogDestination.EVENTS_LOGGER);
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach_appender() {
        appender = new ListAppender<>();
        appender.start();
        eventsLogger.addAppender(appender);
    }

    @AfterEach
    void detach_appender() {
        eventsLogger.detachAppender(appender);
    }

    @Test
    void logs_envelope_json_at_info_to_events_logger() {
        // Given
        LogDestination destination = new LogDestination(codec);
        EventEnvelope envelope = EventEnvelope.added(eventRecord("7", "Warning"));

        // When
        destination.deliver(envelope);

        // Then
        assertThat(appender.list).singleElement().satisfies(event -> assertAll(
                () -> assertThat(event.getLevel()).isEqualTo(Level.INFO),
                () -> assertThat(event.getLoggerName()).isEqualTo("org.eventrouter.destination.log.events"),
                () -> assertThat(codec.fromJson(event.getFormattedMessage())).isEqualTo(envelope)
        ));
    }
}
