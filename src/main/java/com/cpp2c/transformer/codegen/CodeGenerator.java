package com.cpp2c.transformer.codegen;

import com.cpp2c.debug.Debug;
import com.cpp2c.transformer.analysis.TransformationStrategy;
import com.cpp2c.transformer.analysis.Verdict;
import com.cpp2c.transformer.ast.FunctionDefinition;
import com.cpp2c.transformer.ast.MacroDefinition;
import com.cpp2c.transformer.ast.Statement;
import com.cpp2c.transformer.scope.FunctionTable;

import java.util.List;

/**
 * Turns transformable verdicts into function definitions, one per structural key.
 * The function table only grows; the macro table is never touched.
 */
public final class CodeGenerator {

    private static final String TAG = "codegen";

    /** Result of {@link #generate}: the definition to call and whether it was created just now. */
    public static final class Generation {
        public final TransformedDefinition definition;
        public final boolean fresh;

        Generation(TransformedDefinition definition, boolean fresh) {
            this.definition = definition;
            this.fresh = fresh;
        }
    }

    private final InternTable internTable = new InternTable();
    private final NameAllocator names;
    private FunctionTable functions;

    public CodeGenerator(FunctionTable functions, NameAllocator names) {
        this.functions = functions == null ? FunctionTable.empty() : functions;
        this.names = names;
        this.names.reserveAll(this.functions.names());
    }

    public Generation generate(MacroDefinition macro, Verdict verdict) {
        String key = verdict.definitionKey();
        TransformedDefinition existing = internTable.lookup(key);
        if (existing != null) {
            Debug.get().d(TAG, macro.name + " reuses " + existing.emittedName());
            return new Generation(existing, false);
        }

        String name = names.allocate(macro.name);
        FunctionDefinition function = synthesize(verdict.strategy(), macro, name);
        functions = functions.with(function);

        TransformedDefinition td = new TransformedDefinition(key, verdict.strategy(), macro, function);
        internTable.insert(td);
        Debug.get().i(TAG, "generated " + function + " for macro " + macro.name);
        return new Generation(td, true);
    }

    /**
     * Empty body, the macro body as return expression. Parameters keep the macro's
     * names; the body is not substituted because arguments are passed by value.
     */
    public static FunctionDefinition synthesize(TransformationStrategy strategy, MacroDefinition macro, String name) {
        switch (strategy) {
            case OBJECT_LIKE_TO_NULLARY_FUNCTION:
                return new FunctionDefinition(name, List.of(), Statement.skip(), macro.body);
            case FUNCTION_LIKE_TO_FUNCTION:
                return new FunctionDefinition(name, macro.parameters, Statement.skip(), macro.body);
            default:
                throw new IllegalArgumentException("Unsupported strategy: " + strategy);
        }
    }

    public FunctionTable functions() {
        return functions;
    }

    public InternTable internTable() {
        return internTable;
    }

    public NameAllocator names() {
        return names;
    }
}
