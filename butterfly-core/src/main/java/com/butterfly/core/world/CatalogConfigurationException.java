package com.butterfly.core.world;

/**
 * Exception thrown when a world system catalog cannot be built.
 * This occurs when:
 * - A system connects to, or lists an influence factor for, an unknown system id
 * - A category maps to an unknown system id
 * - An influence factor lies outside 0..1
 * - The catalog resource is missing or unreadable
 */
public class CatalogConfigurationException extends RuntimeException {

    private final String systemId;

    public CatalogConfigurationException(String message) {
        super(message);
        this.systemId = null;
    }

    public CatalogConfigurationException(String systemId, String reference) {
        super(String.format(
                "World system '%s' references unknown system '%s'. " +
                "Declare it in the catalog or remove the reference.",
                systemId, reference));
        this.systemId = systemId;
    }

    public CatalogConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.systemId = null;
    }

    /**
     * Id of the system whose declaration is broken, or null when the failure is not tied to one.
     */
    public String getSystemId() {
        return systemId;
    }
}
