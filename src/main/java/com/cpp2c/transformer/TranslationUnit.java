package com.cpp2c.transformer;

import com.cpp2c.transformer.scope.FunctionTable;
import com.cpp2c.transformer.scope.MacroTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Everything the front end discovered in one translation unit, before transformation starts. */
public final class TranslationUnit {
    public final String name;
    public final MacroTable macros;
    public final FunctionTable functions;
    public final List<ExpansionSite> sites;

    public TranslationUnit(String name, MacroTable macros, FunctionTable functions, List<ExpansionSite> sites) {
        this.name = name == null ? "<unit>" : name;
        this.macros = macros == null ? MacroTable.empty() : macros;
        this.functions = functions == null ? FunctionTable.empty() : functions;
        this.sites = Collections.unmodifiableList(new ArrayList<>(sites == null ? List.of() : sites));
    }
}
