package com.example.sgkdocumentreader.model;

import java.time.Instant;

/**
 * Last automatic identity lookup that pointed at a patient. Replaced by the
 * next lookup and cleared by a manual assignment.
 */
public record IdentityQuery(String runId,
                            Instant queriedAt,
                            MatchTier tier,
                            double confidence,
                            String extractedName) {
}
