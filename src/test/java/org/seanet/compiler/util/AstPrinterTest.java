package org.seanet.compiler.util;

import org.seanet.compiler.Compiler;
import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.lexer.TokenType;
import org.seanet.compiler.frontend.parser.ast.types.TypeInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link AstPrinter}.
 */
@Tag("unit")
class AstPrinterTest {

    /**
     * Verifies the rendering of a whole program with structs, functions and statements.
     */
    @Test
    void print_rendersWholeProgram() throws Exception {
        // Arrange
        String source = "struct Node { Node next; int[] data; }\n"
                + "bool find(ref Node n, int v) { var i = 0; while (i < 3) { i++; } return n.data[i] == v; }";

        // Act
        String printed = AstPrinter.print(new Compiler().parse(source, "p.sn"));

        // Assert
        assertThat(printed).isEqualTo("(program "
                + "(struct Node (declare Node next) (declare int[] data)) "
                + "(function bool find ((declare ref Node n) (declare int v)) "
                + "(block (declare var i 0) (while (< i 3) (block (expr (postfix++ i)))) "
                + "(return (== (index (. n data) i) v)))))");
    }

    /**
     * Verifies the rendering of types, including synthesized tokens without a lexeme.
     */
    @Test
    void formatType_rendersAllVariants() {
        // Arrange
        String source = "fun int";
        Token fun = new Token(TokenType.FUN, 0, 3, source, 1, 1, null);
        Token intToken = new Token(TokenType.INT, 4, 3, source, 1, 5, null);
        TypeInfo named = new TypeInfo.Named(intToken, false);
        TypeInfo refArray = new TypeInfo.ArrayOf(new TypeInfo.ArrayOf(named, false), true);
        TypeInfo plainFun = new TypeInfo.FunctionPointer(fun, List.of(), new TypeInfo.Named(fun.synthesize(TokenType.VOID, null), false));

        // Act & Assert
        assertThat(AstPrinter.formatType(named)).isEqualTo("int");
        assertThat(AstPrinter.formatType(refArray)).isEqualTo("ref int[][]");
        assertThat(AstPrinter.formatType(plainFun)).isEqualTo("fun<void>");
        assertThat(AstPrinter.formatType(new TypeInfo.ArrayOf(plainFun, false))).isEqualTo("fun<void>[]");
    }

    /**
     * Verifies that subtrees below the depth limit are elided instead of exhausting the stack.
     */
    @Test
    void print_elidesSubtreesBelowDepthLimit() throws Exception {
        // Arrange
        String source = "void f() { x = 1" + " + 2".repeat(5000) + "; }";

        // Act
        String printed = AstPrinter.print(new Compiler().parse(source, "p.sn"));

        // Assert
        assertThat(printed).startsWith("(program (function void f () (block (expr (= x (+ (+ ");
        assertThat(printed).contains("(+ ... ...)").doesNotContain("1");
        assertThat(printed).endsWith(" 2)" + ")".repeat(5));
    }
}
