package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Optional;

@Schema(description = "Ranked patient candidates and the resulting tier")
public record IdentityResolution(List<MatchCandidate> candidates, MatchTier tier) {

    public IdentityResolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static IdentityResolution none() {
        return new IdentityResolution(List.of(), MatchTier.NONE);
    }

    public Optional<MatchCandidate> best() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    public double confidence() {
        return best().map(MatchCandidate::confidence).orElse(0.0);
    }
}
