package marouter.placement.engine;

import marouter.placement.model.ResourceRequest;

/**
 * Checks a request before it reaches the candidate filter.
 */
public final class RequestValidator {

    private RequestValidator() {
    }

    /**
     * @throws InvalidRequestException if any value is missing or malformed
     */
    public static void validate(ResourceRequest request) {
        if (request == null) {
            throw new InvalidRequestException("request is required");
        }
        Double vram = request.requiredVramGb();
        if (vram == null) {
            throw new InvalidRequestException("requiredVramGb is required");
        }
        requirePositive("requiredVramGb", vram);
        if (request.requiredRamGb() != null) {
            requirePositive("requiredRamGb", request.requiredRamGb());
        }
        if (request.maxDistanceKm() != null) {
            requirePositive("maxDistanceKm", request.maxDistanceKm());
            if (!request.hasLocation()) {
                throw new InvalidRequestException("maxDistanceKm requires latitude and longitude");
            }
        }
        if (request.maxPricePerHour() != null) {
            requirePositive("maxPricePerHour", request.maxPricePerHour());
        }
        Double minReliability = request.minReliability();
        if (minReliability != null
                && (!Double.isFinite(minReliability) || minReliability < 0 || minReliability > 100)) {
            throw new InvalidRequestException("minReliability must be between 0 and 100");
        }
        if (request.hasLocation() && !request.location().isValid()) {
            throw new InvalidRequestException("location is malformed: latitude must be within [-90, 90]"
                    + " and longitude within [-180, 180]");
        }
    }

    private static void requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidRequestException(field + " must be a positive number");
        }
    }
}
