package com.cpp2c.transformer;

import com.cpp2c.transformer.analysis.Verdict;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.codegen.TransformedDefinition;

/** Verdict for one site and, when transformed, the definition called and the new call node. */
public final class SiteOutcome {
    public final ExpansionSite site;
    public final String macroHash;
    public final Verdict verdict;
    public final TransformedDefinition definition;
    public final Invocation rewrittenInvocation;

    SiteOutcome(ExpansionSite site, String macroHash, Verdict verdict,
                TransformedDefinition definition, Invocation rewrittenInvocation) {
        this.site = site;
        this.macroHash = macroHash;
        this.verdict = verdict;
        this.definition = definition;
        this.rewrittenInvocation = rewrittenInvocation;
    }

    public boolean isTransformed() {
        return verdict.isTransformable();
    }

    @Override
    public String toString() {
        return site + " -> " + verdict + (definition == null ? "" : " as " + definition.emittedName());
    }
}
