package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;
import com.purchasingpower.synthflow.parser.JavaSourceParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the repair catalogue to a fixpoint.
 *
 * <p>Output is pretty-printed only when some pass changed the tree. Because passes run until
 * none applies, feeding the output back in changes nothing.
 *
 * <p><b>Thread Safety:</b> Passes are stateless; this class is thread-safe.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class AstRepairerImpl implements AstRepairer {

    private static final int MAX_ROUNDS = 5;

    private final List<RepairPass> passes;

    public AstRepairerImpl() {
        this(List.of(
                new LoopFallbackReturnPass(),
                new TypeIntrospectionPass(),
                new NestedMinMaxPass(),
                new EmailAdjacencyPass(),
                new MissingReturnPass(),
                new FirstMatchEarlyReturnPass(),
                new MissingImportPass()));
    }

    AstRepairerImpl(List<RepairPass> passes) {
        this.passes = List.copyOf(passes);
    }

    @Override
    public String repair(String sourceCode) {
        return repair(sourceCode, RepairContext.empty());
    }

    @Override
    public String repair(String sourceCode, RepairContext context) {
        Optional<CompilationUnit> parsed = JavaSourceParser.tryParse(sourceCode);
        if (parsed.isEmpty()) {
            log.debug("Skipping repair: source does not parse");
            return sourceCode;
        }

        CompilationUnit cu = parsed.get();
        RepairContext effective = context == null ? RepairContext.empty() : context;
        List<String> applied = new ArrayList<>();

        for (int round = 0; round < MAX_ROUNDS; round++) {
            boolean changed = false;
            for (RepairPass pass : passes) {
                if (pass.apply(cu, effective)) {
                    applied.add(pass.name());
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
        }

        if (applied.isEmpty()) {
            return sourceCode;
        }

        log.info("🔧 Applied {} repairs: {}", applied.size(), applied);
        return cu.toString();
    }
}
