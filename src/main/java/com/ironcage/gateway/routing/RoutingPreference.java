package com.ironcage.gateway.routing;

public enum RoutingPreference {
    /** Highest weight first. */
    QUALITY,
    /** Lowest weight first. */
    COST
}
