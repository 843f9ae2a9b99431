package org.seanet.compiler.frontend.parser.ast.types;

import org.seanet.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * Syntactic description of a type expression, as written in declarations and
 * {@code new} expressions. Instances are built bottom-up by the parser and never
 * change afterwards.
 */
public sealed interface TypeInfo permits TypeInfo.Named, TypeInfo.ArrayOf, TypeInfo.FunctionPointer {

    /**
     * Whether the type was marked with {@code ref}.
     * @return true for by-reference types.
     */
    boolean isReference();

    /**
     * A type referenced by a single name, e.g. {@code int}, {@code Point} or {@code var}.
     * @param name The type name token.
     * @param isReference Whether the type was written as {@code ref T}.
     */
    record Named(Token name, boolean isReference) implements TypeInfo {}

    /**
     * An array of another type. Multi-dimensional arrays nest: {@code int[][]} is
     * {@code ArrayOf(ArrayOf(Named(int)))}.
     * @param elementType The type of the elements.
     * @param isReference Whether the array type was written as {@code ref T[]}.
     */
    record ArrayOf(TypeInfo elementType, boolean isReference) implements TypeInfo {}

    /**
     * A function-pointer type, written {@code fun<P1, ..., Pn, R>} or plain {@code fun}.
     * @param funToken The {@code fun} keyword token, used for positions.
     * @param parameterTypes The parameter types in declaration order.
     * @param returnType The return type; a {@code void} {@link Named} type for plain {@code fun}.
     */
    record FunctionPointer(Token funToken, List<TypeInfo> parameterTypes, TypeInfo returnType) implements TypeInfo {

        public FunctionPointer {
            parameterTypes = List.copyOf(parameterTypes);
        }

        /**
         * Function pointers cannot be passed by reference.
         * @return always false.
         */
        @Override
        public boolean isReference() {
            return false;
        }
    }
}
