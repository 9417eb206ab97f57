package info.isaksson.erland.sforganalyzer.config;

/**
 * An option value that makes analysis meaningless (for example a non-positive bound) or an override that
 * cannot be applied. This is the only condition that prevents a run from starting.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
