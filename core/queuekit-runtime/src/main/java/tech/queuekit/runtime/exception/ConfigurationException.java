package tech.queuekit.runtime.exception;

import tech.queuekit.queue.QueueKitException;

/**
 * Invalid runtime configuration. Raised synchronously while registering
 * queues and handlers; the runtime must not start with invalid config.
 */
public class ConfigurationException extends QueueKitException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
