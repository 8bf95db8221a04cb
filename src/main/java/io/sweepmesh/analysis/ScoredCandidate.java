package io.sweepmesh.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScoredCandidate(
        @JsonProperty("candidate") Candidate candidate,
        @JsonProperty("score") double score,
        @JsonProperty("pareto_optimal") boolean paretoOptimal
) {
}
