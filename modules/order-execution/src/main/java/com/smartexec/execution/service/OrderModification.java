package com.smartexec.execution.service;

import com.smartexec.domain.orders.Order;
import com.smartexec.execution.dispatch.DispatchResult;

public record OrderModification(Order order, DispatchResult dispatch) {}
