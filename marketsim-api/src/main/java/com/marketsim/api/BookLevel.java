package com.marketsim.api;

/**
 * Aggregated view of one price level.
 */
public record BookLevel(double price, long quantity, int orderCount) {
}
