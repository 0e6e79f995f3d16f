package com.cpp2c.transformer;

import com.cpp2c.transformer.ast.Expr.Invocation;
import com.cpp2c.transformer.ast.SourceLocation;
import com.cpp2c.transformer.ast.Statement.Stmt;
import com.cpp2c.transformer.scope.CallerScope;
import com.cpp2c.transformer.scope.MacroTable;

/**
 * One macro expansion recorded by the front end.
 *
 * {@link #enclosingStatement} is the top-level statement the expansion sits in (may be
 * {@code null} when the front end only hands over the expression). {@link #macroTable}
 * is the table snapshot at the point of expansion; {@code null} means "the unit's table".
 * {@link #nestingDepth} is 0 for an expansion written directly in the source, 1 for
 * one inside another expansion's argument, and so on.
 */
public final class ExpansionSite {
    public final Invocation invocation;
    public final SourceLocation spellingLocation;
    public final String enclosingDeclaration;
    public final Stmt enclosingStatement;
    public final CallerScope callerScope;
    public final int nestingDepth;
    public final MacroTable macroTable;

    public ExpansionSite(Invocation invocation, SourceLocation spellingLocation, String enclosingDeclaration,
                         Stmt enclosingStatement, CallerScope callerScope, int nestingDepth, MacroTable macroTable) {
        if (invocation == null) throw new IllegalArgumentException("Expansion site without invocation");
        this.invocation = invocation;
        this.spellingLocation = spellingLocation == null ? SourceLocation.UNKNOWN : spellingLocation;
        this.enclosingDeclaration = enclosingDeclaration == null ? "" : enclosingDeclaration;
        this.enclosingStatement = enclosingStatement;
        this.callerScope = callerScope == null ? CallerScope.empty() : callerScope;
        this.nestingDepth = nestingDepth;
        this.macroTable = macroTable;
    }

    public static ExpansionSite of(Invocation invocation, Stmt enclosingStatement, CallerScope callerScope) {
        return new ExpansionSite(invocation, SourceLocation.UNKNOWN, "", enclosingStatement, callerScope, 0, null);
    }

    public ExpansionSite at(SourceLocation location, String declaration) {
        return new ExpansionSite(invocation, location, declaration, enclosingStatement, callerScope, nestingDepth, macroTable);
    }

    public ExpansionSite nestedAt(int depth) {
        return new ExpansionSite(invocation, spellingLocation, enclosingDeclaration, enclosingStatement, callerScope, depth, macroTable);
    }

    public ExpansionSite withMacroTable(MacroTable snapshot) {
        return new ExpansionSite(invocation, spellingLocation, enclosingDeclaration, enclosingStatement, callerScope, nestingDepth, snapshot);
    }

    public String macroName() {
        return invocation.name;
    }

    @Override
    public String toString() {
        return invocation.name + "@" + spellingLocation;
    }
}
