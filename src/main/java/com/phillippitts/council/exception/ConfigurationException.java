package com.phillippitts.council.exception;

/**
 * Thrown for invalid configuration (unknown backend id, judge equal to synthesizer) or a
 * missing collaborator. Always raised before any priced call is made.
 */
public class ConfigurationException extends CouncilException {

    private final String property;

    public ConfigurationException(String property, String message) {
        super("Invalid configuration '" + property + "': " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
