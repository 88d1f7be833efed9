package ai.stubdoc.translator.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * One JSON object per log event, written without a JSON library.
 *
 * <p>Fields: {@code time}, {@code level}, {@code logger}, {@code message} and, when the event carries one,
 * {@code error} with the exception class and message.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder json = new StringBuilder(160);
        json.append('{');
        field(json, "time", DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(event.getTimeStamp())));
        json.append(',');
        field(json, "level", String.valueOf(event.getLevel()));
        json.append(',');
        field(json, "logger", event.getLoggerName());
        json.append(',');
        field(json, "message", event.getFormattedMessage());
        IThrowableProxy error = event.getThrowableProxy();
        if (error != null) {
            json.append(',');
            field(json, "error", error.getClassName() + ": " + error.getMessage());
        }
        json.append('}').append(System.lineSeparator());
        return json.toString();
    }

    private static void field(StringBuilder json, String name, String value) {
        appendString(json, name);
        json.append(':');
        if (value == null) {
            json.append("null");
        } else {
            appendString(json, value);
        }
    }

    static void appendString(StringBuilder json, String value) {
        json.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '"' || ch == '\\') {
                json.append('\\').append(ch);
            } else if (ch == '\n') {
                json.append("\\n");
            } else if (ch == '\r') {
                json.append("\\r");
            } else if (ch == '\t') {
                json.append("\\t");
            } else if (ch < 0x20) {
                json.append(String.format("\\u%04x", (int) ch));
            } else {
                json.append(ch);
            }
        }
        json.append('"');
    }
}
