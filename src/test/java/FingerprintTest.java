import static com.cpp2c.transformer.ast.Expr.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.cpp2c.transformer.ast.Fingerprint;
import com.cpp2c.transformer.ast.MacroDefinition;
import com.cpp2c.transformer.ast.SourceLocation;

public class FingerprintTest {

    private static ExprInterface plusOne(String p) {
        return paren(binary(BinaryOp.ADD, paren(var(p)), num(1)));
    }

    @Test
    void macroHash_isMd5HexAndIgnoresLocation() {
        MacroDefinition inc = MacroDefinition.functionLike("INC", List.of("a"), plusOne("a"));
        String h = Fingerprint.macroHash(inc);
        assertTrue(h.matches("[0-9a-f]{32}"), h);
        assertEquals(h, Fingerprint.macroHash(inc.at(SourceLocation.of("other.c", 40, 1))));
    }

    @Test
    void macroHash_distinguishesNameShapeAndParameters() {
        MacroDefinition inc = MacroDefinition.functionLike("INC", List.of("a"), plusOne("a"));
        assertNotEquals(Fingerprint.macroHash(inc), Fingerprint.macroHash(MacroDefinition.functionLike("ADD1", List.of("a"), plusOne("a"))));
        assertNotEquals(Fingerprint.macroHash(inc), Fingerprint.macroHash(MacroDefinition.functionLike("INC", List.of("b"), plusOne("b"))));

        // #define ONE 1 versus #define ONE() 1
        assertNotEquals(Fingerprint.macroHash(MacroDefinition.objectLike("ONE", num(1))),
                Fingerprint.macroHash(MacroDefinition.functionLike("ONE", List.of(), num(1))));
    }

    @Test
    void structuralKey_abstractsParameterNamesOnly() {
        assertEquals(Fingerprint.structuralKey(List.of("a"), plusOne("a")), Fingerprint.structuralKey(List.of("n"), plusOne("n")));

        // a free variable keeps its name
        assertNotEquals(Fingerprint.structuralKey(List.of("a"), plusOne("g")), Fingerprint.structuralKey(List.of("a"), plusOne("h")));
        // arity is part of the key even for unused parameters
        assertNotEquals(Fingerprint.structuralKey(List.of("a"), num(1)), Fingerprint.structuralKey(List.of("a", "b"), num(1)));
        // parameter order matters
        ExprInterface sub = binary(BinaryOp.SUB, var("a"), var("b"));
        assertNotEquals(Fingerprint.structuralKey(List.of("a", "b"), sub), Fingerprint.structuralKey(List.of("b", "a"), sub));
    }

    @Test
    void trace_seesParametersAsPositions() {
        List<String> tokens = new ArrayList<>();
        Fingerprint.structuralKey(List.of("x"), plusOne("x"), tokens::add);

        assertEquals(List.of("arity:", "1", ";"), tokens.subList(0, 3));
        assertTrue(tokens.contains("$"));
        assertFalse(tokens.contains("x"));
        assertTrue(tokens.contains("ADD"));
    }

    @Test
    void tokenBoundaries_doNotMerge() {
        // "ab" + "c" and "a" + "bc" as free variable names inside one binary node
        ExprInterface left = binary(BinaryOp.ADD, var("ab"), var("c"));
        ExprInterface right = binary(BinaryOp.ADD, var("a"), var("bc"));
        assertNotEquals(Fingerprint.structuralKey(List.of(), left), Fingerprint.structuralKey(List.of(), right));
    }
}
