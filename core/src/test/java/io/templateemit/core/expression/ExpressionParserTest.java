package io.templateemit.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.templateemit.core.error.ExpressionParseException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExpressionParser")
class ExpressionParserTest {

    @Test
    void literalWithoutBrackets() {
        assertThat(ExpressionParser.parse("westus")).isEqualTo(TokenExpression.of("westus"));
        assertThat(ExpressionParser.isExpression("westus")).isFalse();
    }

    @Test
    void escapedLiteralDropsOneBracket() {
        assertThat(ExpressionParser.parse("[[x]")).isEqualTo(TokenExpression.of("[x]"));
        assertThat(ExpressionParser.isExpression("[[x]")).isFalse();
    }

    @Test
    void parsesCallsWithAccessors() {
        TargetExpression parsed = ExpressionParser.parse("[reference('vm', '2020-01-01', 'full').properties['a b'][0]]");

        assertThat(parsed).isEqualTo(new FunctionExpression(
                "reference",
                List.of(TokenExpression.of("vm"), TokenExpression.of("2020-01-01"), TokenExpression.of("full")),
                List.of(TokenExpression.of("properties"), TokenExpression.of("a b"), TokenExpression.of(0))));
    }

    @Test
    void parsesNegativeIntegersAndEscapedQuotes() {
        TargetExpression parsed = ExpressionParser.parse("[add(-3, length('it''s'))]");

        assertThat(parsed).isEqualTo(FunctionExpression.of(
                "add", TokenExpression.of(-3), FunctionExpression.of("length", TokenExpression.of("it's"))));
    }

    @Test
    void serializedExpressionParsesBackToSameTree() {
        var expression = FunctionExpression.of(
                        "format",
                        TokenExpression.of("{0}-{1}"),
                        FunctionExpression.of("parameters", TokenExpression.of("p")),
                        FunctionExpression.of("copyIndex"))
                .appendProperties(TokenExpression.of("length"));

        assertThat(ExpressionParser.parse(ExpressionSerializer.serialize(expression))).isEqualTo(expression);
    }

    @Test
    void unterminatedStringFails() {
        assertThatThrownBy(() -> ExpressionParser.parse("[concat('abc)]"))
                .isInstanceOf(ExpressionParseException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    void trailingInputFails() {
        assertThatThrownBy(() -> ExpressionParser.parse("[true() false()]"))
                .isInstanceOf(ExpressionParseException.class);
    }
}
