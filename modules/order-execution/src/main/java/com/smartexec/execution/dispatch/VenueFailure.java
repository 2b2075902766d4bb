package com.smartexec.execution.dispatch;

/**
 * A venue call that produced no fill.
 *
 * @param fallback true when the failed call was itself a fallback and was not retried
 */
public record VenueFailure(String venue, long quantity, String reason, boolean fallback) {}
