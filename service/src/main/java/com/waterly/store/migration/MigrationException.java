package com.waterly.store.migration;

/**
 * Checksum or version conflict, or a script that failed mid-apply. Fatal to startup.
 */
public class MigrationException extends RuntimeException {

  public MigrationException(String message) {
    super(message);
  }

  public MigrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
