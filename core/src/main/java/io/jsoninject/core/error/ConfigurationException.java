package io.jsoninject.core.error;

/**
 * Thrown when an injection request or definition is unusable: missing or invalid target path,
 * unknown source, missing source text, or more than one source field populated. Raised before any
 * source is executed, so no fragment is ever written. URN: {@code
 * urn:json-inject:error:configuration}
 */
public final class ConfigurationException extends InjectionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:json-inject:error:configuration";

    private final String field;

    public ConfigurationException(String message, String injectionName, String field) {
        super(message, injectionName, Phase.CONFIGURATION);
        this.field = field;
    }

    public ConfigurationException(String message, Throwable cause, String injectionName, String field) {
        super(message, cause, injectionName, Phase.CONFIGURATION);
        this.field = field;
    }

    /** The configuration field at fault (e.g. {@code "target"}), or {@code null}. */
    public String field() {
        return field;
    }

    @Override
    public String urn() {
        return URN;
    }
}
