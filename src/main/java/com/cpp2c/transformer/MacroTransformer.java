package com.cpp2c.transformer;

import com.cpp2c.debug.Debug;
import com.cpp2c.transformer.analysis.SideEffectPolicy;
import com.cpp2c.transformer.analysis.TransformabilityDecider;
import com.cpp2c.transformer.analysis.Verdict;
import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.Fingerprint;
import com.cpp2c.transformer.ast.MacroDefinition;
import com.cpp2c.transformer.ast.Statement.Stmt;
import com.cpp2c.transformer.codegen.CallSiteRewriter;
import com.cpp2c.transformer.codegen.CodeGenerator;
import com.cpp2c.transformer.codegen.NameAllocator;
import com.cpp2c.transformer.codegen.TransformedDefinition;
import com.cpp2c.transformer.emit.CollectingFactSink;
import com.cpp2c.transformer.emit.Fact;
import com.cpp2c.transformer.emit.FactSink;
import com.cpp2c.transformer.scope.Definitions;
import com.cpp2c.transformer.scope.MacroTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Macro-to-function transformation pass over one translation unit.
 *
 * - Single pass, no backtracking: each site is decided once, in order of nesting
 *   depth (outer first, stable otherwise), against the current function table.
 * - Transformable sites get a generated function (shared between sites whose macros
 *   have the same structural key) and their invocation is renamed to call it.
 * - Rejected sites are left alone and reported with their reason.
 * - A front-end contract violation aborts the pass with {@link TransformerContractException}.
 *
 * Not thread-safe; use one instance per translation unit.
 */
public class MacroTransformer {

    private static final String TAG = "transform";

    private SideEffectPolicy sideEffectPolicy = SideEffectPolicy.EAGER_EVALUATION_SAFE;
    private String namePrefix = "cpp2c_";
    private FactSink factSink = new CollectingFactSink();

    public void setSideEffectPolicy(SideEffectPolicy policy) {
        this.sideEffectPolicy = (policy == null) ? SideEffectPolicy.EAGER_EVALUATION_SAFE : policy;
    }

    public SideEffectPolicy getSideEffectPolicy() { return sideEffectPolicy; }

    public void setNamePrefix(String prefix) {
        this.namePrefix = (prefix == null) ? "" : prefix.trim();
    }

    public String getNamePrefix() { return namePrefix; }

    public void setFactSink(FactSink sink) {
        this.factSink = (sink == null) ? new CollectingFactSink() : sink;
    }

    public FactSink getFactSink() { return factSink; }

    public TransformationResult transform(TranslationUnit unit) {
        Debug.get().i(TAG, "unit " + unit.name + ": " + unit.macros.size() + " macro(s), "
                + unit.sites.size() + " expansion site(s), policy " + sideEffectPolicy);

        emitDefinitions(unit);

        NameAllocator names = new NameAllocator(namePrefix);
        reserveVisibleNames(unit, names);
        CodeGenerator generator = new CodeGenerator(unit.functions, names);
        TransformabilityDecider decider = new TransformabilityDecider(sideEffectPolicy);

        List<ExpansionSite> ordered = new ArrayList<>(unit.sites);
        ordered.sort(Comparator.comparingInt(s -> s.nestingDepth));

        List<SiteOutcome> outcomes = new ArrayList<>(ordered.size());
        IdentityHashMap<Stmt, Stmt> rewritten = new IdentityHashMap<>();

        for (ExpansionSite site : ordered) {
            MacroTable macros = site.macroTable != null ? site.macroTable : unit.macros;
            MacroDefinition macro = macros.get(site.macroName());
            if (macro == null) {
                throw violation("Expansion site " + site + " names macro '" + site.macroName()
                        + "' which is not in the macro table");
            }

            String hash = Fingerprint.macroHash(macro);
            factSink.emit(Fact.macroExpansion(hash, site.spellingLocation));

            Definitions current = Definitions.of(macros, generator.functions());
            Verdict verdict = decider.decide(macro, site.invocation.arguments, site.callerScope, current);

            if (!verdict.isTransformable()) {
                factSink.emit(Fact.untransformedExpansion(hash, site.spellingLocation, site.enclosingDeclaration,
                        verdict.reason().category, verdict.reason().code));
                outcomes.add(new SiteOutcome(site, hash, verdict, null, null));
                continue;
            }

            CodeGenerator.Generation generation = generator.generate(macro, verdict);
            TransformedDefinition definition = generation.definition;
            if (generation.fresh) {
                factSink.emit(Fact.transformedDefinition(Fingerprint.macroHash(definition.origin),
                        definition.signatureWithoutName(), definition.emittedName()));
            }

            Invocation call = CallSiteRewriter.rewrite(site.invocation, definition.emittedName());
            if (site.enclosingStatement != null) {
                Stmt before = rewritten.getOrDefault(site.enclosingStatement, site.enclosingStatement);
                Stmt after = CallSiteRewriter.rewrite(before, site.invocation, definition.emittedName());
                if (after == null) {
                    throw violation("Expansion site " + site + " does not occur in its enclosing statement");
                }
                rewritten.put(site.enclosingStatement, after);
            }

            factSink.emit(Fact.transformedExpansion(hash, site.spellingLocation, site.enclosingDeclaration,
                    definition.emittedName()));
            outcomes.add(new SiteOutcome(site, hash, verdict, definition, call));
        }

        factSink.flush();
        Debug.get().i(TAG, "unit " + unit.name + ": " + generator.internTable().size() + " function(s) generated, "
                + outcomes.stream().filter(SiteOutcome::isTransformed).count() + "/" + outcomes.size() + " site(s) transformed");

        return new TransformationResult(outcomes, generator.functions(),
                new ArrayList<>(generator.internTable().definitions()), rewritten);
    }

    private void emitDefinitions(TranslationUnit unit) {
        Set<String> seen = new HashSet<>();
        List<MacroDefinition> all = new ArrayList<>(unit.macros.definitions());
        for (ExpansionSite site : unit.sites) {
            if (site.macroTable != null) all.addAll(site.macroTable.definitions());
        }
        for (MacroDefinition macro : all) {
            String hash = Fingerprint.macroHash(macro);
            if (seen.add(hash + "@" + macro.location)) {
                factSink.emit(Fact.macroDefinition(hash, macro.location));
            }
        }
    }

    private static void reserveVisibleNames(TranslationUnit unit, NameAllocator names) {
        names.reserveAll(unit.functions.names());
        names.reserveAll(unit.macros.names());
        for (ExpansionSite site : unit.sites) {
            names.reserveAll(site.callerScope.localNames);
            names.reserveAll(site.callerScope.globalNames);
            if (site.macroTable != null) names.reserveAll(site.macroTable.names());
        }
    }

    private static TransformerContractException violation(String message) {
        Debug.get().e(TAG, message);
        return new TransformerContractException(message);
    }
}
