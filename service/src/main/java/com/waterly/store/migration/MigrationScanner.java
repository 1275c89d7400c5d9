package com.waterly.store.migration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * Discovers migration scripts on the classpath.
 *
 * <p>Versioned scripts are named {@code V<version>__<description>.sql} and come first, ordered by
 * version. Repeatable scripts are named {@code R__<description>.sql} and follow, ordered by
 * description.
 */
@Component
public class MigrationScanner {
  private static final Logger log = LoggerFactory.getLogger(MigrationScanner.class);
  private static final Pattern VERSIONED = Pattern.compile("^V([0-9]+(?:[._][0-9]+)*)__(.+)\\.sql$");
  private static final Pattern REPEATABLE = Pattern.compile("^R__(.+)\\.sql$");

  private final String location;

  public MigrationScanner(
      @Value("${waterly.migrations.location:classpath*:db/migration/*.sql}") String location) {
    this.location = location;
  }

  public List<Migration> scan() {
    Resource[] resources;
    try {
      resources = new PathMatchingResourcePatternResolver().getResources(location);
    } catch (IOException ex) {
      throw new MigrationException("Unable to list migrations at " + location, ex);
    }
    List<Migration> migrations = new ArrayList<>(resources.length);
    for (Resource resource : resources) {
      String filename = resource.getFilename();
      if (filename == null) {
        continue;
      }
      migrations.add(fromScript(filename, read(resource)));
    }
    List<Migration> ordered = order(migrations);
    log.debug("Discovered {} migrations at {}", ordered.size(), location);
    return ordered;
  }

  static Migration fromScript(String filename, String script) {
    Matcher versioned = VERSIONED.matcher(filename);
    if (versioned.matches()) {
      return Migration.versioned(versioned.group(1), describe(versioned.group(2)), script);
    }
    Matcher repeatable = REPEATABLE.matcher(filename);
    if (repeatable.matches()) {
      return Migration.repeatable(describe(repeatable.group(1)), script);
    }
    throw new MigrationException("Unrecognised migration file name: " + filename);
  }

  static List<Migration> order(List<Migration> migrations) {
    Map<MigrationVersion, Migration> byVersion = new TreeMap<>();
    for (Migration migration : migrations) {
      if (migration.repeatable()) {
        continue;
      }
      Migration clash = byVersion.put(migration.version(), migration);
      if (clash != null) {
        throw new MigrationException("Version " + migration.versionLabel()
            + " is claimed by both '" + clash.description() + "' (" + clash.versionLabel()
            + ") and '" + migration.description() + "'");
      }
    }
    List<Migration> out = new ArrayList<>(migrations);
    out.sort(Comparator
        .comparing((Migration m) -> m.repeatable())
        .thenComparing(Migration::version, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Migration::description));
    return out;
  }

  private static String describe(String raw) {
    return raw.replace('_', ' ').trim();
  }

  private static String read(Resource resource) {
    try (InputStream in = resource.getInputStream()) {
      return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new MigrationException("Unable to read migration " + resource.getDescription(), ex);
    }
  }
}
