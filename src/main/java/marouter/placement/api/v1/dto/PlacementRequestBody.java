package marouter.placement.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import marouter.placement.engine.InvalidRequestException;
import marouter.placement.model.Priority;
import marouter.placement.model.ResourceRequest;

/**
 * Request DTO for placement requests and quotes.
 * POST /api/v1/placement/requests
 * POST /api/v1/public/placement/quote
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlacementRequestBody(
        @JsonProperty("requesterId") String requesterId,
        @JsonProperty("modelName") String modelName,
        @JsonProperty("requiredVramGb") Double requiredVramGb,
        @JsonProperty("requiredRamGb") Double requiredRamGb,
        @JsonProperty("preferredRegion") String preferredRegion,
        @JsonProperty("priority") String priority,
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude,
        @JsonProperty("maxDistanceKm") Double maxDistanceKm,
        @JsonProperty("maxPricePerHour") Double maxPricePerHour,
        @JsonProperty("preferLocal") Boolean preferLocal,
        @JsonProperty("minReliability") Double minReliability) {

    /**
     * Convert to the domain request. Value checks are left to the engine;
     * only shape problems (half a coordinate pair, unknown priority) are
     * rejected here.
     */
    public ResourceRequest toResourceRequest() {
        if ((latitude == null) != (longitude == null)) {
            throw new InvalidRequestException("latitude and longitude must be given together");
        }

        ResourceRequest.Builder builder = ResourceRequest.builder()
                .requesterId(requesterId)
                .modelName(modelName)
                .requiredVramGb(requiredVramGb)
                .requiredRamGb(requiredRamGb)
                .preferredRegion(preferredRegion != null && !preferredRegion.isBlank() ? preferredRegion : null)
                .maxDistanceKm(maxDistanceKm)
                .maxPricePerHour(maxPricePerHour)
                .minReliability(minReliability)
                .preferLocal(Boolean.TRUE.equals(preferLocal));

        try {
            builder.priority(Priority.fromString(priority));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }

        if (latitude != null) {
            builder.location(latitude, longitude);
        }
        return builder.build();
    }
}
