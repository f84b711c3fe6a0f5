package im.arun.treebinder.classify;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.treebinder.model.ScalarNode;

import java.time.temporal.TemporalAccessor;

/**
 * Formats primitives, strings, enums, temporal values and Jackson value nodes.
 * Objects that only inherit {@link Object#toString()} are rejected, since their
 * text is an identity hash rather than a value.
 */
public class DefaultScalarFormatter implements ScalarFormatter {

    @Override
    public String format(Object value) throws FormatException {
        if (value instanceof ScalarNode) {
            value = ((ScalarNode) value).getValue();
        }
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character
                || value instanceof Enum || value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof JsonNode) {
            JsonNode node = (JsonNode) value;
            if (node.isContainerNode()) {
                throw new FormatException("Container JSON node is not a scalar");
            }
            return node.isNull() || node.isMissingNode() ? "null" : node.asText();
        }
        if (!overridesToString(value.getClass())) {
            throw new FormatException("No text form for " + value.getClass().getName());
        }
        try {
            return value.toString();
        } catch (RuntimeException e) {
            throw new FormatException("toString() failed for " + value.getClass().getName(), e);
        }
    }

    private static boolean overridesToString(Class<?> type) {
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
