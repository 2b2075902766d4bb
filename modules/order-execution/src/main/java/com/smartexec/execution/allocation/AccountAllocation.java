package com.smartexec.execution.allocation;

import java.math.BigDecimal;

public record AccountAllocation(
    String orderId, String account, long quantity, BigDecimal averagePrice) {}
