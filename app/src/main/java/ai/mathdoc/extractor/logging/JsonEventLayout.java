package ai.mathdoc.extractor.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * One-line JSON layout for logback events, rendered with Jackson.
 */
public class JsonEventLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String doLayout(ILoggingEvent event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        node.put("level", String.valueOf(event.getLevel()));
        node.put("logger", event.getLoggerName());
        node.put("thread", event.getThreadName());
        node.put("message", event.getFormattedMessage());

        Map<String, String> mdc = safeMdc(event);
        if (!mdc.isEmpty()) {
            ObjectNode mdcNode = node.putObject("mdc");
            mdc.forEach(mdcNode::put);
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            ObjectNode error = node.putObject("error");
            error.put("type", throwable.getClassName());
            error.put("message", throwable.getMessage());
        }

        try {
            return mapper.writeValueAsString(node) + System.lineSeparator();
        } catch (JsonProcessingException ex) {
            addError("Failed to render log event as JSON", ex);
            return "{\"level\":\"ERROR\",\"message\":\"unserializable log event\"}" + System.lineSeparator();
        }
    }

    private Map<String, String> safeMdc(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            return Map.of();
        }
    }
}
