package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.purchasingpower.synthflow.parser.JavaSourceParser;

import java.util.Optional;

/**
 * Moves a fallback return that was nested one level too deep inside a search loop.
 *
 * <pre>
 * for (...) {                     for (...) {
 *     if (match) { return i; }        if (match) { return i; }
 *     return -1;          ==&gt;     }
 * }                               return -1;
 * </pre>
 *
 * Only loops that already exit early on a condition qualify; their intended exit is "return on
 * match, otherwise fall through", so an unconditional return as the last body statement cannot be
 * what was meant.
 */
class LoopFallbackReturnPass implements RepairPass {

    @Override
    public String name() {
        return "loop-fallback-return";
    }

    @Override
    public boolean apply(CompilationUnit cu, RepairContext context) {
        boolean modified = false;
        for (MethodDeclaration method : JavaSourceParser.targetMethods(cu, context.getMethodName())) {
            for (Statement loop : JavaSourceParser.findOwnLoops(method)) {
                modified |= fix(loop);
            }
        }
        return modified;
    }

    private boolean fix(Statement loop) {
        Optional<BlockStmt> body = RepairSupport.loopBody(loop);
        Optional<BlockStmt> parent = RepairSupport.parentBlock(loop);
        if (body.isEmpty() || parent.isEmpty() || !RepairSupport.canExitNormally(loop)) {
            return false;
        }

        NodeList<Statement> statements = body.get().getStatements();
        if (statements.size() < 2 || !statements.get(statements.size() - 1).isReturnStmt()) {
            return false;
        }

        boolean conditionalExit = statements.subList(0, statements.size() - 1).stream()
                .anyMatch(s -> !s.isReturnStmt() && !JavaSourceParser.findOwn(s, ReturnStmt.class).isEmpty());
        if (!conditionalExit) {
            return false;
        }

        Statement fallback = statements.remove(statements.size() - 1);

        NodeList<Statement> outer = parent.get().getStatements();
        int index = RepairSupport.indexOf(outer, loop);
        boolean alreadyFollowedByReturn = index + 1 < outer.size() && outer.get(index + 1).isReturnStmt();
        if (!alreadyFollowedByReturn) {
            outer.add(index + 1, fallback);
        }
        return true;
    }
}
