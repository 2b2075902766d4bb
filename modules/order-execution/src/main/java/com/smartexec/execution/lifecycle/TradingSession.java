package com.smartexec.execution.lifecycle;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/** Daily session close used to expire DAY orders. */
public record TradingSession(LocalTime closeTime, ZoneId zone) {
  public TradingSession {
    Objects.requireNonNull(closeTime, "closeTime must not be null");
    Objects.requireNonNull(zone, "zone must not be null");
  }

  /** The first session close at or after {@code createdAt}. */
  public Instant closeFor(Instant createdAt) {
    ZonedDateTime created = createdAt.atZone(zone);
    LocalDate day = created.toLocalDate();
    ZonedDateTime close = ZonedDateTime.of(day, closeTime, zone);
    if (created.isAfter(close)) {
      close = ZonedDateTime.of(day.plusDays(1), closeTime, zone);
    }
    return close.toInstant();
  }

  public boolean isClosedFor(Instant createdAt, Instant now) {
    return !now.isBefore(closeFor(createdAt));
  }
}
