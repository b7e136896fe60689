package ai.ebook.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private LoggerContext context;
    private SimpleJsonLayout layout;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        context.start();
        layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
    }

    @Test
    void formatsEventAsJson() {
        LoggingEvent event = event("hello \"world\"");

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello \\\"world\\\"\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"mdc\"").doesNotContain("\"exception\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesPartFromMdc() {
        LoggingEvent event = event("translating");
        event.setMDCPropertyMap(Map.of("part", "chapter1.xhtml"));

        assertThat(layout.doLayout(event)).contains("\"mdc\":{\"part\":\"chapter1.xhtml\"}");
    }

    @Test
    void summarizesExceptionChain() {
        LoggingEvent event = event("failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("outer", new IllegalArgumentException("inner"))));

        assertThat(layout.doLayout(event)).contains(
                "\"exception\":\"java.lang.IllegalStateException: outer <- java.lang.IllegalArgumentException: inner\"");
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
