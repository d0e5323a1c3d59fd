package com.revolution.backend.security;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

public final class SecurityMarkers {

    /** Tags log lines that operators route to the security audit appender. */
    public static final Marker SECURITY = MarkerFactory.getMarker("SECURITY");

    private SecurityMarkers() {
    }
}
