package com.purchasingpower.synthflow.service.selection;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class SelectionResult {

    GenerationCandidate best;

    /** Every candidate generated, in dispatch order. */
    List<GenerationCandidate> candidates;

    /** True when a perfect candidate stopped generation before n were produced. */
    boolean earlyExit;

    public List<Double> getCandidateScores() {
        return candidates.stream().map(GenerationCandidate::getScore).collect(Collectors.toList());
    }
}
