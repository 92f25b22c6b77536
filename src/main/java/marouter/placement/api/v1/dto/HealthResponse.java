package marouter.placement.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("scoringPolicy") String scoringPolicy,
        @JsonProperty("nodes") Integer nodes,
        @JsonProperty("decisions") Integer decisions) {

    public static HealthResponse healthy(String uptime, String version, String scoringPolicy, int nodes,
            int decisions) {
        return new HealthResponse("healthy", "ok", uptime, version, scoringPolicy, nodes, decisions);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null);
    }
}
