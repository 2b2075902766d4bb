package com.smartexec.domain.orders;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Parameters of an algorithmic parent order. Which fields are required depends on the
 * {@link AlgorithmType}; see {@link #validateFor(AlgorithmType)}.
 */
public record AlgorithmParams(
    Instant startTime,
    Instant endTime,
    Duration sliceInterval,
    List<BigDecimal> customCurve,
    BigDecimal minParticipationRate,
    BigDecimal maxParticipationRate,
    BigDecimal targetParticipationRate,
    Long displayQuantity,
    BenchmarkType benchmark) {
  public static final Duration DEFAULT_SLICE_INTERVAL = Duration.ofMinutes(5);

  public AlgorithmParams {
    customCurve = customCurve == null ? List.of() : List.copyOf(customCurve);
  }

  public static AlgorithmParams twap(Instant startTime, Instant endTime, Duration sliceInterval) {
    return new AlgorithmParams(
        startTime, endTime, sliceInterval, List.of(), null, null, null, null, null);
  }

  public static AlgorithmParams vwap(
      Instant startTime, Instant endTime, Duration sliceInterval, List<BigDecimal> customCurve) {
    return new AlgorithmParams(
        startTime, endTime, sliceInterval, customCurve, null, null, null, null, null);
  }

  public static AlgorithmParams pov(
      Instant startTime,
      Instant endTime,
      BigDecimal minParticipationRate,
      BigDecimal maxParticipationRate) {
    return new AlgorithmParams(
        startTime,
        endTime,
        null,
        List.of(),
        minParticipationRate,
        maxParticipationRate,
        null,
        null,
        null);
  }

  public static AlgorithmParams iceberg(
      Instant startTime, Instant endTime, long displayQuantity, Duration refreshInterval) {
    return new AlgorithmParams(
        startTime, endTime, refreshInterval, List.of(), null, null, null, displayQuantity, null);
  }

  public Duration effectiveSliceInterval() {
    if (sliceInterval == null || sliceInterval.isZero() || sliceInterval.isNegative()) {
      return DEFAULT_SLICE_INTERVAL;
    }
    return sliceInterval;
  }

  public BenchmarkType effectiveBenchmark() {
    return benchmark == null ? BenchmarkType.ARRIVAL_PRICE : benchmark;
  }

  /** Target rate for POV; the midpoint of the band when no explicit target is set. */
  public BigDecimal effectiveTargetParticipationRate() {
    if (targetParticipationRate != null) {
      return targetParticipationRate;
    }
    return minParticipationRate.add(maxParticipationRate).divide(BigDecimal.valueOf(2));
  }

  public AlgorithmParams withParticipation(
      BigDecimal nextMin, BigDecimal nextMax, BigDecimal nextTarget) {
    return new AlgorithmParams(
        startTime,
        endTime,
        sliceInterval,
        customCurve,
        nextMin == null ? minParticipationRate : nextMin,
        nextMax == null ? maxParticipationRate : nextMax,
        nextTarget == null ? targetParticipationRate : nextTarget,
        displayQuantity,
        benchmark);
  }

  public AlgorithmParams withBenchmark(BenchmarkType nextBenchmark) {
    return new AlgorithmParams(
        startTime,
        endTime,
        sliceInterval,
        customCurve,
        minParticipationRate,
        maxParticipationRate,
        targetParticipationRate,
        displayQuantity,
        nextBenchmark);
  }

  public void validateFor(AlgorithmType type) {
    if (type == null) {
      throw new OrderValidationException("algorithmType must not be null");
    }
    if (startTime == null || endTime == null) {
      throw new OrderValidationException(type + " order requires startTime and endTime");
    }
    if (!endTime.isAfter(startTime)) {
      throw new OrderValidationException("endTime must be after startTime");
    }
    switch (type) {
      case TWAP -> {}
      case VWAP -> validateCurve();
      case POV -> validateParticipation();
      case ICEBERG -> {
        if (displayQuantity == null || displayQuantity <= 0) {
          throw new OrderValidationException("ICEBERG order requires displayQuantity > 0");
        }
      }
    }
  }

  private void validateCurve() {
    BigDecimal total = BigDecimal.ZERO;
    for (BigDecimal weight : customCurve) {
      if (weight == null || weight.signum() < 0) {
        throw new OrderValidationException("customCurve weights must be >= 0");
      }
      total = total.add(weight);
    }
    if (!customCurve.isEmpty() && total.signum() == 0) {
      throw new OrderValidationException("customCurve must contain a positive weight");
    }
  }

  private void validateParticipation() {
    if (minParticipationRate == null || maxParticipationRate == null) {
      throw new OrderValidationException(
          "POV order requires minParticipationRate and maxParticipationRate");
    }
    if (minParticipationRate.signum() < 0
        || maxParticipationRate.signum() <= 0
        || maxParticipationRate.compareTo(BigDecimal.ONE) > 0
        || minParticipationRate.compareTo(maxParticipationRate) > 0) {
      throw new OrderValidationException(
          "participation rates must satisfy 0 <= min <= max <= 1 and max > 0");
    }
    if (targetParticipationRate != null
        && (targetParticipationRate.compareTo(minParticipationRate) < 0
            || targetParticipationRate.compareTo(maxParticipationRate) > 0)) {
      throw new OrderValidationException(
          "targetParticipationRate must lie within [minParticipationRate, maxParticipationRate]");
    }
  }
}
