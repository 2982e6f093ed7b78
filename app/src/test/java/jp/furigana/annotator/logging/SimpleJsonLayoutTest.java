package jp.furigana.annotator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private final LoggerContext context = new LoggerContext();

    @Test
    void formatsEventAsJson() {
        LoggingEvent event = event("hello world");

        String json = layout().doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello world\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"document\"", "\"mdc\"", "\"exception\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void liftsDocumentOutOfMdc() {
        LoggingEvent event = event("annotated");
        event.setMDCPropertyMap(Map.of(SimpleJsonLayout.DOCUMENT_KEY, "chapter1.xhtml", "task", "annotate"));

        String json = layout().doLayout(event);

        assertThat(json).contains("\"document\":\"chapter1.xhtml\"");
        assertThat(json).contains("\"mdc\":{\"task\":\"annotate\"}");
    }

    @Test
    void includesExceptionSummary() {
        LoggingEvent event = event("failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("dictionary missing")));

        String json = layout().doLayout(event);

        assertThat(json).contains("\"exception\":\"java.lang.IllegalStateException: dictionary missing\"");
    }

    @Test
    void escapesControlCharacters() {
        assertThat(SimpleJsonLayout.quote("a\"b\nc\u0001")).isEqualTo("\"a\\\"b\\nc\\u0001\"");
        assertThat(SimpleJsonLayout.quote(null)).isEqualTo("null");
    }

    private SimpleJsonLayout layout() {
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
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
