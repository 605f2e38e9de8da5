package de.bsommerfeld.fdf.service;

/**
 * Thrown when a configuration file exists but cannot be read.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
