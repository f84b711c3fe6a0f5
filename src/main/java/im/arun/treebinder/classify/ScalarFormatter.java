package im.arun.treebinder.classify;

/**
 * Renders a scalar input value as label text.
 */
@FunctionalInterface
public interface ScalarFormatter {

    String format(Object value) throws FormatException;
}
