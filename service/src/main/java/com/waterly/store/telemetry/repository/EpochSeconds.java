package com.waterly.store.telemetry.repository;

import java.time.Instant;

/**
 * Converts range bounds to the whole epoch seconds stored in the tables. A lower bound rounds up
 * and an upper bound rounds down, so a row at a stored second lies inside the range exactly when
 * its instant does.
 */
final class EpochSeconds {

  private EpochSeconds() {
  }

  static long lowerBound(Instant from) {
    return from.getNano() > 0 ? from.getEpochSecond() + 1 : from.getEpochSecond();
  }

  static long upperBound(Instant to) {
    return to.getEpochSecond();
  }
}
