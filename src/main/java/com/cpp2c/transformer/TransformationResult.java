package com.cpp2c.transformer;

import com.cpp2c.transformer.ast.Statement.Stmt;
import com.cpp2c.transformer.codegen.TransformedDefinition;
import com.cpp2c.transformer.scope.FunctionTable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class TransformationResult {
    public final List<SiteOutcome> outcomes;
    public final FunctionTable functions;
    public final List<TransformedDefinition> generated;
    private final Map<Stmt, Stmt> rewrittenStatements;

    TransformationResult(List<SiteOutcome> outcomes, FunctionTable functions,
                         List<TransformedDefinition> generated, IdentityHashMap<Stmt, Stmt> rewrittenStatements) {
        this.outcomes = Collections.unmodifiableList(outcomes);
        this.functions = functions;
        this.generated = Collections.unmodifiableList(generated);
        this.rewrittenStatements = rewrittenStatements;
    }

    /** The final version of an enclosing statement; the statement itself if nothing in it was rewritten. */
    public Stmt rewritten(Stmt original) {
        Stmt s = rewrittenStatements.get(original);
        return s == null ? original : s;
    }

    public List<SiteOutcome> transformed() {
        return outcomes.stream().filter(SiteOutcome::isTransformed).collect(Collectors.toList());
    }

    public List<SiteOutcome> untransformed() {
        return outcomes.stream().filter(o -> !o.isTransformed()).collect(Collectors.toList());
    }
}
