package com.waterly.store.migration;

import com.waterly.store.error.ValidationException;

/**
 * One schema or seed-data change. A {@code null} version marks a repeatable migration, which is
 * re-applied whenever its checksum changes.
 */
public record Migration(MigrationVersion version, String description, String checksum, String script) {

  public Migration {
    ValidationException.requireText("description", description);
    ValidationException.requireText("script", script);
    ValidationException.requireText("checksum", checksum);
  }

  public static Migration versioned(String version, String description, String script) {
    return new Migration(MigrationVersion.parse(version), description, Checksums.sha256(script), script);
  }

  public static Migration repeatable(String description, String script) {
    return new Migration(null, description, Checksums.sha256(script), script);
  }

  public boolean repeatable() {
    return version == null;
  }

  public String versionLabel() {
    return version == null ? null : version.toString();
  }

  public String displayName() {
    return repeatable() ? "R " + description : "V" + version + " " + description;
  }
}
