package gpuhub.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /api/v1/workers/{id}/active
 */
public record SetActiveRequest(@JsonProperty("active") Boolean active) {

    public void validate() {
        if (active == null) {
            throw new IllegalArgumentException("active is required");
        }
    }
}
