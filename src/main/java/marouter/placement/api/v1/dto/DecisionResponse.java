package marouter.placement.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import marouter.placement.model.Decision;
import marouter.placement.model.SubScore;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a placement decision. The same shape is returned for
 * recorded placements and for quotes; {@code requestId} is null for quotes
 * and {@code chosenNodeId} is null when no node was eligible.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DecisionResponse(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("chosenNodeId") Long chosenNodeId,
        @JsonProperty("chosenNodeName") String chosenNodeName,
        @JsonProperty("policy") String policy,
        @JsonProperty("fitScore") double fitScore,
        @JsonProperty("rawScore") double rawScore,
        @JsonProperty("subScores") List<SubScore> subScores,
        @JsonProperty("headroomGb") Double headroomGb,
        @JsonProperty("justification") String justification,
        @JsonProperty("createdAt") Instant createdAt) {

    /** Create response from domain model */
    public static DecisionResponse from(Decision decision) {
        return new DecisionResponse(
                decision.requestId(),
                decision.chosenNodeId(),
                decision.chosenNodeName(),
                decision.policy(),
                decision.fitScore(),
                decision.rawScore(),
                decision.subScores(),
                decision.headroomGb(),
                decision.justification(),
                decision.createdAt());
    }

    /** Rebuild the domain model, e.g. on the client side */
    public Decision toDecision() {
        return Decision.builder()
                .requestId(requestId)
                .chosenNodeId(chosenNodeId)
                .chosenNodeName(chosenNodeName)
                .policy(policy)
                .fitScore(fitScore)
                .rawScore(rawScore)
                .subScores(subScores)
                .headroomGb(headroomGb)
                .justification(justification)
                .createdAt(createdAt)
                .build();
    }
}
