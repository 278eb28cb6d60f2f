package com.purchasingpower.synthflow.planner;

import com.purchasingpower.synthflow.model.ir.TypedHole;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Reads candidates from {@link TypedHole#getCandidateDomain()}, keeping their order.
 */
@Component
public class DomainCandidateProvider implements CandidateProvider {

    @Override
    public Optional<List<String>> candidates(TypedHole hole) {
        List<String> domain = hole.getCandidateDomain();
        if (domain == null || domain.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(domain.stream().distinct().toList());
    }
}
