package io.templateemit.core.engine;

import static io.templateemit.core.syntax.SyntaxFactory.array;
import static io.templateemit.core.syntax.SyntaxFactory.arrayAccess;
import static io.templateemit.core.syntax.SyntaxFactory.bool;
import static io.templateemit.core.syntax.SyntaxFactory.call;
import static io.templateemit.core.syntax.SyntaxFactory.integer;
import static io.templateemit.core.syntax.SyntaxFactory.interpolated;
import static io.templateemit.core.syntax.SyntaxFactory.nullLiteral;
import static io.templateemit.core.syntax.SyntaxFactory.object;
import static io.templateemit.core.syntax.SyntaxFactory.property;
import static io.templateemit.core.syntax.SyntaxFactory.string;
import static io.templateemit.core.syntax.SyntaxFactory.unary;
import static io.templateemit.core.syntax.SyntaxFactory.variableAccess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.JsonNode;
import io.templateemit.core.error.IndexReplacementException;
import io.templateemit.core.expression.ExpressionParser;
import io.templateemit.core.expression.ExpressionSerializer;
import io.templateemit.core.expression.TokenExpression;
import io.templateemit.core.operation.ConstantValueOperation;
import io.templateemit.core.syntax.ObjectSyntax;
import io.templateemit.core.syntax.SyntaxBase;
import io.templateemit.core.syntax.UnaryOperator;
import io.templateemit.core.testkit.EmitHarness;
import io.templateemit.core.testkit.ProgramFixture;
import io.templateemit.core.testkit.TestSemanticModel;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExpressionEmitter")
class ExpressionEmitterTest {

    private static JsonNode emit(SyntaxBase value) throws IOException {
        TestSemanticModel model = ProgramFixture.bindExpressions(value);
        return EmitHarness.emitValue(ProgramFixture.context(model), emitter -> emitter.emitExpression(value));
    }

    @Nested
    @DisplayName("Value fidelity")
    class ValueFidelity {

        @Test
        @DisplayName("Integers and booleans are written natively")
        void integersAndBooleansAreNative() throws IOException {
            JsonNode node = emit(object(
                    property("count", integer(3)),
                    property("negative", unary(UnaryOperator.MINUS, integer(7))),
                    property("enabled", bool(true)),
                    property("nothing", nullLiteral())));

            assertThat(node.get("count").isIntegralNumber()).isTrue();
            assertThat(node.get("count").asLong()).isEqualTo(3);
            assertThat(node.get("negative").isIntegralNumber()).isTrue();
            assertThat(node.get("negative").asLong()).isEqualTo(-7);
            assertThat(node.get("enabled").isBoolean()).isTrue();
            assertThat(node.get("nothing").isNull()).isTrue();
        }

        @Test
        void arraysKeepItemOrder() throws IOException {
            JsonNode node = emit(array(integer(1), string("two"), bool(false)));

            assertThat(node.toString()).isEqualTo("[1,\"two\",false]");
        }

        @Test
        @DisplayName("A literal starting with '[' is escaped and reads back as the same literal")
        void leadingBracketIsEscaped() throws IOException {
            JsonNode node = emit(object(property("literal", string("[not an expression]"))));

            String leaf = node.get("literal").asText();
            assertThat(leaf).isEqualTo("[[not an expression]");
            assertThat(ExpressionParser.parse(leaf)).isEqualTo(TokenExpression.of("[not an expression]"));
        }

        @Test
        void expressionsAreWrittenAsBracketedStrings() throws IOException {
            JsonNode node = emit(object(
                    property("location", variableAccess("loc")),
                    property("label", interpolated(List.of("", "-x"), variableAccess("loc")))));

            assertThat(node.get("location").asText()).isEqualTo("[parameters('loc')]");
            assertThat(node.get("label").asText()).isEqualTo("[format('{0}-x', parameters('loc'))]");
        }

        @Test
        void inlinedObjectIsWrittenNatively() throws IOException {
            JsonNode node = emit(object(property("value", variableAccess("inlined")), property("v", variableAccess("plain"))));

            assertThat(node.get("value").asText()).isEqualTo("abc");
            assertThat(node.get("v").asText()).isEqualTo("[variables('plain')]");
        }

        @Test
        void anyWrapperIsTransparent() throws IOException {
            JsonNode node = emit(call("any", object(property("a", integer(1)))));

            assertThat(node.get("a").asLong()).isEqualTo(1);
        }

        @Test
        void computedKeyIsSerialized() throws IOException {
            JsonNode node = emit(object(property(variableAccess("loc"), integer(1))));

            assertThat(node.has("[parameters('loc')]")).isTrue();
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        void omittedPropertiesAreSkipped() throws IOException {
            ObjectSyntax body = object(
                    property("name", string("n")), property("location", variableAccess("loc")), property("tags", object()));
            TestSemanticModel model = ProgramFixture.bindExpressions(body);

            JsonNode node = EmitHarness.emitObject(
                    ProgramFixture.context(model), emitter -> emitter.emitObjectProperties(body, Set.of("name", "tags")));

            assertThat(node.fieldNames()).toIterable().containsExactly("location");
        }

        @Test
        void propertyOverloads() throws IOException {
            TestSemanticModel model = ProgramFixture.bind();
            JsonNode node = EmitHarness.emitObject(ProgramFixture.context(model), emitter -> {
                emitter.emitProperty("plain", "text");
                emitter.emitProperty("escaped", "[x]");
                emitter.emitProperty("number", TokenExpression.of(9));
                emitter.emitProperty("syntax", string("s"));
                emitter.emitPropertyWithTransform(
                        "constant", ConstantValueOperation.of("abc"), ExpressionConverter::asFunctionExpression);
                emitter.emitOptionalPropertyExpression("absent", null);
                emitter.emitOptionalPropertyExpression("present", integer(2));
            });

            assertThat(node.get("plain").asText()).isEqualTo("text");
            assertThat(node.get("escaped").asText()).isEqualTo("[[x]");
            assertThat(node.get("number").asLong()).isEqualTo(9);
            assertThat(node.get("syntax").asText()).isEqualTo("s");
            assertThat(node.get("constant").asText()).isEqualTo("[string('abc')]");
            assertThat(node.has("absent")).isFalse();
            assertThat(node.get("present").asLong()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Resource references")
    class ResourceReferences {

        @Test
        void unqualifiedAndQualifiedIds() throws IOException {
            TestSemanticModel model = ProgramFixture.bind();
            var kv = model.resource("kv");
            SyntaxBase context = kv.symbol().declaringSyntax();

            JsonNode node = EmitHarness.emitObject(ProgramFixture.context(model), emitter -> {
                emitter.emitProperty("unqualified", () -> emitter.emitUnqualifiedResourceId(kv, null, context));
                emitter.emitProperty("qualified", () -> emitter.emitResourceIdReference(kv, null, context));
                emitter.emitProperty("symbolic", () -> emitter.emitIndexedSymbolReference(kv, null, context));
            });

            assertThat(node.get("unqualified").asText()).isEqualTo("[resourceId('Microsoft.KeyVault/vaults', 'vault1')]");
            assertThat(node.get("qualified").asText()).isEqualTo("[resourceId('Microsoft.KeyVault/vaults', 'vault1')]");
            assertThat(node.get("symbolic").asText()).isEqualTo("kv");
        }

        @Test
        void indexedCollectionReferences() throws IOException {
            TestSemanticModel model = ProgramFixture.bind();
            var sa = model.resource("sa");
            var mods = model.module("mods");
            SyntaxBase context = model.resource("kv").symbol().declaringSyntax();

            JsonNode node = EmitHarness.emitObject(ProgramFixture.context(model), emitter -> {
                emitter.emitProperty("id", () -> emitter.emitResourceIdReference(sa, integer(3), context));
                emitter.emitProperty("symbol", () -> emitter.emitIndexedSymbolReference(sa, integer(3), context));
                emitter.emitProperty("module", () -> emitter.emitResourceIdReference(mods, integer(1), context));
                emitter.emitProperty("moduleSymbol", () -> emitter.emitIndexedSymbolReference(mods, integer(1), context));
                emitter.emitProperty("name", () -> emitter.emitExpression(sa.nameSyntax(), integer(0), context));
            });

            assertThat(node.get("id").asText())
                    .isEqualTo("[resourceId('Microsoft.Storage/storageAccounts', parameters('xs')[3])]");
            assertThat(node.get("symbol").asText()).isEqualTo("[format('sa[{0}]', 3)]");
            assertThat(node.get("module").asText())
                    .isEqualTo("[resourceId('Microsoft.Resources/deployments', parameters('xs')[1])]");
            assertThat(node.get("moduleSymbol").asText()).isEqualTo("[format('mods[{0}]', 1)]");
            assertThat(node.get("name").asText()).isEqualTo("[parameters('xs')[0]]");
        }

        @Test
        void dependencyStyleFollowsSettings() throws IOException {
            TestSemanticModel model = ProgramFixture.bind();
            var kv = model.resource("kv");
            SyntaxBase context = kv.symbol().declaringSyntax();

            JsonNode computed = EmitHarness.emitValue(
                    ProgramFixture.context(model), emitter -> emitter.emitDependencyReference(kv, null, context));
            JsonNode symbolic = EmitHarness.emitValue(
                    ProgramFixture.symbolicContext(model), emitter -> emitter.emitDependencyReference(kv, null, context));

            assertThat(computed.asText()).isEqualTo("[resourceId('Microsoft.KeyVault/vaults', 'vault1')]");
            assertThat(symbolic.asText()).isEqualTo("kv");
        }

        @Test
        void missingIndexForLoopedResourceFails() {
            TestSemanticModel model = ProgramFixture.bind();
            var sa = model.resource("sa");
            SyntaxBase context = model.resource("kv").symbol().declaringSyntax();

            assertThatThrownBy(() -> EmitHarness.emitValue(
                            ProgramFixture.context(model), emitter -> emitter.emitResourceIdReference(sa, null, context)))
                    .isInstanceOf(IndexReplacementException.class)
                    .satisfies(e -> assertThat(((IndexReplacementException) e).inaccessibleLoopCount()).isEqualTo(1));
        }

        @Test
        void fullyQualifiedNameAndManagementGroupId() throws IOException {
            TestSemanticModel model = ProgramFixture.bind();
            SyntaxBase context = model.resource("kv").symbol().declaringSyntax();
            var emitter = new ExpressionEmitter(
                    new JsonFactory().createGenerator(new StringWriter()), ProgramFixture.context(model));

            assertThat(ExpressionSerializer.serialize(emitter.getFullyQualifiedResourceName(model.resource("secret"))))
                    .isEqualTo("[format('{0}/{1}', 'vault1', 'mysecret')]");
            assertThat(ExpressionSerializer.serialize(
                            emitter.getManagementGroupResourceId(string("mg"), null, context, true)))
                    .isEqualTo("[tenantResourceId('Microsoft.Management/managementGroups', 'mg')]");
        }
    }

    @Test
    @DisplayName("Emitting the same tree twice gives identical output")
    void emissionIsDeterministic() throws IOException {
        ObjectSyntax body = object(
                property("a", integer(1)),
                property("b", variableAccess("loc")),
                property("c", array(string("[x"), bool(true))),
                property("d", arrayAccess(variableAccess("xs"), integer(0))));
        TestSemanticModel model = ProgramFixture.bindExpressions(body);
        EmitterContext context = ProgramFixture.context(model);

        String first = EmitHarness.emitValueText(context, emitter -> emitter.emitExpression(body));
        String second = EmitHarness.emitValueText(context, emitter -> emitter.emitExpression(body));

        assertThat(first).isEqualTo(second);
    }
}
