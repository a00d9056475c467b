package gpuhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * POST /api/v1/workers/{id}/maintenance
 * The window defaults to one hour.
 */
public record MaintenanceRequest(@JsonProperty("windowSeconds") Long windowSeconds) {

    public static final long DEFAULT_WINDOW_SECONDS = 3600;

    public Duration window() {
        long seconds = windowSeconds != null ? windowSeconds : DEFAULT_WINDOW_SECONDS;
        if (seconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive");
        }
        return Duration.ofSeconds(seconds);
    }
}
