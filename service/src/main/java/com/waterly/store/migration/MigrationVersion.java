package com.waterly.store.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dotted numeric schema version such as {@code 1.0.2}. Underscores are accepted as separators so
 * that file names like {@code V1_0_2__...} parse the same way. Trailing zero parts are not
 * significant: {@code 1.0} and {@code 1.0.0} are the same version.
 */
public record MigrationVersion(List<Integer> parts) implements Comparable<MigrationVersion> {

  public MigrationVersion {
    if (parts == null || parts.isEmpty()) {
      throw new IllegalArgumentException("version must have at least one part");
    }
    parts = List.copyOf(parts);
  }

  public static MigrationVersion parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("version must not be blank");
    }
    List<Integer> parts = new ArrayList<>();
    for (String part : text.trim().split("[._]")) {
      try {
        parts.add(Integer.parseInt(part));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid version '" + text + "'", ex);
      }
    }
    return new MigrationVersion(parts);
  }

  @Override
  public int compareTo(MigrationVersion other) {
    int length = Math.max(parts.size(), other.parts.size());
    for (int i = 0; i < length; i++) {
      int left = i < parts.size() ? parts.get(i) : 0;
      int right = i < other.parts.size() ? other.parts.get(i) : 0;
      if (left != right) {
        return Integer.compare(left, right);
      }
    }
    return 0;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MigrationVersion version && compareTo(version) == 0;
  }

  @Override
  public int hashCode() {
    return significantParts().hashCode();
  }

  @Override
  public String toString() {
    return parts.stream().map(String::valueOf).collect(Collectors.joining("."));
  }

  private List<Integer> significantParts() {
    int end = parts.size();
    while (end > 1 && parts.get(end - 1) == 0) {
      end--;
    }
    return parts.subList(0, end);
  }
}
