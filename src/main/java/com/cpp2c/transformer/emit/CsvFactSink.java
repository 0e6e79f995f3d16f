package com.cpp2c.transformer.emit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Line format understood by the existing reporting scripts, e.g.
 * <pre>
 * CPP2C:Macro Definition,"&lt;hash&gt;",file.c:3:9
 * CPP2C:Untransformed Expansion,"&lt;hash&gt;",file.c:12:5,main,Hygiene,CapturesCallerScope
 * CPP2C:Transformed Definition,"&lt;hash&gt;","int (int a, int b)",cpp2c_add
 * </pre>
 */
public final class CsvFactSink implements FactSink {

    private static final String PREFIX = "CPP2C:";

    private final Writer out;

    public CsvFactSink(Writer out) {
        this.out = out;
    }

    @Override
    public void emit(Fact fact) {
        write(format(fact));
    }

    public static String format(Fact fact) {
        StringBuilder sb = new StringBuilder(PREFIX)
                .append(fact.kind.label).append(',')
                .append('"').append(fact.macroHash).append('"');
        switch (fact.kind) {
            case MACRO_DEFINITION:
            case MACRO_EXPANSION:
                sb.append(',').append(fact.location);
                break;
            case TRANSFORMED_DEFINITION:
                sb.append(',').append('"').append(fact.signature).append('"')
                  .append(',').append(fact.emittedName);
                break;
            case TRANSFORMED_EXPANSION:
                sb.append(',').append(fact.location)
                  .append(',').append(fact.enclosingDeclaration);
                break;
            case UNTRANSFORMED_EXPANSION:
                sb.append(',').append(fact.location)
                  .append(',').append(fact.enclosingDeclaration)
                  .append(',').append(fact.category)
                  .append(',').append(fact.reason);
                break;
            default:
                throw new IllegalArgumentException("Unknown fact kind: " + fact.kind);
        }
        return sb.toString();
    }

    private void write(String line) {
        try {
            out.write(line);
            out.write('\n');
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write fact record", e);
        }
    }

    @Override
    public void flush() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush fact records", e);
        }
    }
}
