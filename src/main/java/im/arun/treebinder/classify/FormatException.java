package im.arun.treebinder.classify;

/**
 * A scalar value could not be rendered as label text.
 */
public class FormatException extends Exception {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
