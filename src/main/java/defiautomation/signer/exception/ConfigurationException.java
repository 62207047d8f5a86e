package defiautomation.signer.exception;

/**
 * Missing or malformed secrets and backend settings. Fatal at startup, never retried.
 */
public class ConfigurationException extends SignerException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("CONFIGURATION_ERROR", message, cause);
    }
}
