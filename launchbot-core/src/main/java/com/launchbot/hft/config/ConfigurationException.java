package com.launchbot.hft.config;

/**
 * Invalid or missing configuration detected at startup. Fatal.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
