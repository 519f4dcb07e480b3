package io.templateemit.core.syntax;

import java.util.Arrays;
import java.util.List;

/**
 * Factory for synthesized syntax nodes. Every node gets {@link TextSpan#NIL}; use the
 * constructors directly when a source location matters.
 */
public final class SyntaxFactory {

    private SyntaxFactory() {}

    public static BooleanLiteralSyntax bool(boolean value) {
        return new BooleanLiteralSyntax(TextSpan.NIL, value);
    }

    public static IntegerLiteralSyntax integer(long value) {
        return new IntegerLiteralSyntax(TextSpan.NIL, value);
    }

    public static NullLiteralSyntax nullLiteral() {
        return new NullLiteralSyntax(TextSpan.NIL);
    }

    public static StringSyntax string(String value) {
        return new StringSyntax(TextSpan.NIL, List.of(value), List.of());
    }

    /** Interpolated string; {@code segments} must have one more element than {@code expressions}. */
    public static StringSyntax interpolated(List<String> segments, SyntaxBase... expressions) {
        return new StringSyntax(TextSpan.NIL, segments, Arrays.asList(expressions));
    }

    public static IdentifierSyntax identifier(String name) {
        return new IdentifierSyntax(TextSpan.NIL, name);
    }

    public static ObjectPropertySyntax property(String key, SyntaxBase value) {
        return new ObjectPropertySyntax(TextSpan.NIL, identifier(key), value);
    }

    public static ObjectPropertySyntax property(SyntaxBase key, SyntaxBase value) {
        return new ObjectPropertySyntax(TextSpan.NIL, key, value);
    }

    public static ObjectSyntax object(ObjectPropertySyntax... properties) {
        return new ObjectSyntax(TextSpan.NIL, Arrays.asList(properties));
    }

    public static ArraySyntax array(SyntaxBase... items) {
        return new ArraySyntax(TextSpan.NIL, Arrays.asList(items));
    }

    public static ForSyntax forLoop(String itemName, SyntaxBase expression, SyntaxBase body) {
        return new ForSyntax(TextSpan.NIL, new LocalVariableSyntax(TextSpan.NIL, itemName), null, expression, body);
    }

    public static ForSyntax forLoop(String itemName, String indexName, SyntaxBase expression, SyntaxBase body) {
        return new ForSyntax(
                TextSpan.NIL,
                new LocalVariableSyntax(TextSpan.NIL, itemName),
                new LocalVariableSyntax(TextSpan.NIL, indexName),
                expression,
                body);
    }

    public static VariableAccessSyntax variableAccess(String name) {
        return new VariableAccessSyntax(TextSpan.NIL, name);
    }

    public static FunctionCallSyntax call(String name, SyntaxBase... arguments) {
        return new FunctionCallSyntax(TextSpan.NIL, name, Arrays.asList(arguments));
    }

    public static InstanceFunctionCallSyntax instanceCall(SyntaxBase base, String name, SyntaxBase... arguments) {
        return new InstanceFunctionCallSyntax(TextSpan.NIL, base, name, Arrays.asList(arguments));
    }

    public static PropertyAccessSyntax propertyAccess(SyntaxBase base, String propertyName) {
        return new PropertyAccessSyntax(TextSpan.NIL, base, propertyName);
    }

    public static ArrayAccessSyntax arrayAccess(SyntaxBase base, SyntaxBase index) {
        return new ArrayAccessSyntax(TextSpan.NIL, base, index);
    }

    public static ResourceAccessSyntax resourceAccess(SyntaxBase base, String resourceName) {
        return new ResourceAccessSyntax(TextSpan.NIL, base, resourceName);
    }

    public static UnaryOperationSyntax unary(UnaryOperator operator, SyntaxBase expression) {
        return new UnaryOperationSyntax(TextSpan.NIL, operator, expression);
    }

    public static BinaryOperationSyntax binary(SyntaxBase left, BinaryOperator operator, SyntaxBase right) {
        return new BinaryOperationSyntax(TextSpan.NIL, left, operator, right);
    }

    public static TernaryOperationSyntax ternary(SyntaxBase condition, SyntaxBase whenTrue, SyntaxBase whenFalse) {
        return new TernaryOperationSyntax(TextSpan.NIL, condition, whenTrue, whenFalse);
    }

    public static ParenthesizedExpressionSyntax parentheses(SyntaxBase expression) {
        return new ParenthesizedExpressionSyntax(TextSpan.NIL, expression);
    }

    public static ParameterDeclarationSyntax parameter(String name, String type) {
        return new ParameterDeclarationSyntax(TextSpan.NIL, name, type, null);
    }

    public static VariableDeclarationSyntax variable(String name, SyntaxBase value) {
        return new VariableDeclarationSyntax(TextSpan.NIL, name, value);
    }

    public static ResourceDeclarationSyntax resource(String name, String type, SyntaxBase value) {
        return new ResourceDeclarationSyntax(TextSpan.NIL, name, type, value);
    }

    public static ModuleDeclarationSyntax module(String name, String path, SyntaxBase value) {
        return new ModuleDeclarationSyntax(TextSpan.NIL, name, path, value);
    }

    public static OutputDeclarationSyntax output(String name, String type, SyntaxBase value) {
        return new OutputDeclarationSyntax(TextSpan.NIL, name, type, value);
    }

    public static ProgramSyntax program(DeclarationSyntax... declarations) {
        return new ProgramSyntax(TextSpan.NIL, Arrays.asList(declarations));
    }
}
