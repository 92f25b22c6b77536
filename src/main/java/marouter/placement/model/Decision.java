package marouter.placement.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of one placement evaluation.
 *
 * A decision without a chosen node is a valid outcome: no node was eligible
 * and the justification says which criterion eliminated them. Re-evaluating a
 * request produces a new decision, never an update of an existing one.
 */
public final class Decision {
    private final String requestId;
    private final Long chosenNodeId;
    private final String chosenNodeName;
    private final String policy;
    private final double fitScore;
    private final double rawScore;
    private final List<SubScore> subScores;
    private final Double headroomGb;
    private final String justification;
    private final Instant createdAt;

    private Decision(Builder builder) {
        this.requestId = builder.requestId;
        this.chosenNodeId = builder.chosenNodeId;
        this.chosenNodeName = builder.chosenNodeName;
        this.policy = Objects.requireNonNull(builder.policy, "policy is required");
        this.fitScore = builder.fitScore;
        this.rawScore = builder.rawScore;
        this.subScores = builder.subScores != null ? List.copyOf(builder.subScores) : List.of();
        this.headroomGb = builder.headroomGb;
        this.justification = Objects.requireNonNull(builder.justification, "justification is required");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
    }

    // Getters
    /** Id of the originating request, null in quote mode */
    public String requestId() {
        return requestId;
    }

    public Long chosenNodeId() {
        return chosenNodeId;
    }

    public String chosenNodeName() {
        return chosenNodeName;
    }

    public String policy() {
        return policy;
    }

    public double fitScore() {
        return fitScore;
    }

    public double rawScore() {
        return rawScore;
    }

    public List<SubScore> subScores() {
        return subScores;
    }

    public Double headroomGb() {
        return headroomGb;
    }

    public String justification() {
        return justification;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean hasChosenNode() {
        return chosenNodeId != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .requestId(requestId)
                .chosenNodeId(chosenNodeId)
                .chosenNodeName(chosenNodeName)
                .policy(policy)
                .fitScore(fitScore)
                .rawScore(rawScore)
                .subScores(subScores)
                .headroomGb(headroomGb)
                .justification(justification)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private Long chosenNodeId;
        private String chosenNodeName;
        private String policy;
        private double fitScore;
        private double rawScore;
        private List<SubScore> subScores;
        private Double headroomGb;
        private String justification;
        private Instant createdAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder chosenNodeId(Long chosenNodeId) {
            this.chosenNodeId = chosenNodeId;
            return this;
        }

        public Builder chosenNodeName(String chosenNodeName) {
            this.chosenNodeName = chosenNodeName;
            return this;
        }

        public Builder policy(String policy) {
            this.policy = policy;
            return this;
        }

        public Builder fitScore(double fitScore) {
            this.fitScore = fitScore;
            return this;
        }

        public Builder rawScore(double rawScore) {
            this.rawScore = rawScore;
            return this;
        }

        public Builder subScores(List<SubScore> subScores) {
            this.subScores = subScores;
            return this;
        }

        public Builder headroomGb(Double headroomGb) {
            this.headroomGb = headroomGb;
            return this;
        }

        public Builder justification(String justification) {
            this.justification = justification;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Decision build() {
            return new Decision(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Decision that))
            return false;
        return Double.compare(fitScore, that.fitScore) == 0
                && Double.compare(rawScore, that.rawScore) == 0
                && Objects.equals(requestId, that.requestId)
                && Objects.equals(chosenNodeId, that.chosenNodeId)
                && Objects.equals(chosenNodeName, that.chosenNodeName)
                && policy.equals(that.policy)
                && subScores.equals(that.subScores)
                && Objects.equals(headroomGb, that.headroomGb)
                && justification.equals(that.justification)
                && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, chosenNodeId, chosenNodeName, policy, fitScore, rawScore, subScores,
                headroomGb, justification, createdAt);
    }

    @Override
    public String toString() {
        return "Decision{requestId='" + requestId + "', node=" + chosenNodeId + ", score=" + fitScore
                + ", policy=" + policy + "}";
    }
}
