package com.smartexec.execution.algo;

import java.math.BigDecimal;

/** Parameter changes for a running algorithm. Null fields keep their current value. */
public record AlgoAdjustment(
    BigDecimal minParticipationRate,
    BigDecimal maxParticipationRate,
    BigDecimal targetParticipationRate,
    BigDecimal aggressiveness) {

  public static AlgoAdjustment participation(BigDecimal min, BigDecimal max) {
    return new AlgoAdjustment(min, max, null, null);
  }

  public static AlgoAdjustment aggressiveness(BigDecimal aggressiveness) {
    return new AlgoAdjustment(null, null, null, aggressiveness);
  }

  public boolean changesParticipation() {
    return minParticipationRate != null
        || maxParticipationRate != null
        || targetParticipationRate != null;
  }
}
