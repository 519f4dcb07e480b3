package io.templateemit.core.engine;

import static io.templateemit.core.syntax.SyntaxFactory.array;
import static io.templateemit.core.syntax.SyntaxFactory.call;
import static io.templateemit.core.syntax.SyntaxFactory.forLoop;
import static io.templateemit.core.syntax.SyntaxFactory.integer;
import static io.templateemit.core.syntax.SyntaxFactory.object;
import static io.templateemit.core.syntax.SyntaxFactory.property;
import static io.templateemit.core.syntax.SyntaxFactory.resource;
import static io.templateemit.core.syntax.SyntaxFactory.string;
import static io.templateemit.core.syntax.SyntaxFactory.variable;
import static io.templateemit.core.syntax.SyntaxFactory.variableAccess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.templateemit.core.error.UnsupportedConstructException;
import io.templateemit.core.operation.ForLoopOperation;
import io.templateemit.core.syntax.ForSyntax;
import io.templateemit.core.syntax.ObjectSyntax;
import io.templateemit.core.syntax.SyntaxBase;
import io.templateemit.core.testkit.EmitHarness;
import io.templateemit.core.testkit.ProgramFixture;
import io.templateemit.core.testkit.TemplateExpressionEvaluator;
import io.templateemit.core.testkit.TestSemanticModel;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Copy loop desugaring: grouping, count, input shape, batching and copy index overrides. */
@DisplayName("Copy loop emission")
class CopyLoopEmissionTest {

    private static final String RESOURCE_TYPE = "Microsoft.Foo/bars@2020-01-01";

    private static JsonSchema copySchema;

    @BeforeAll
    static void loadSchema() throws IOException {
        try (InputStream in = CopyLoopEmissionTest.class.getResourceAsStream("/schemas/copy-object.schema.json")) {
            copySchema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(in);
        }
    }

    private static void assertValidCopyObject(JsonNode copyObject) {
        Set<ValidationMessage> errors = copySchema.validate(copyObject);
        assertThat(errors).as("schema violations for %s", copyObject).isEmpty();
    }

    /** Binds {@code resource res = { name: 'r', properties: <properties> }}. */
    private static TestSemanticModel bindProperties(ObjectSyntax properties) {
        return ProgramFixture.bind(resource(
                "res", RESOURCE_TYPE, object(property("name", string("r")), property("properties", properties))));
    }

    @Nested
    @DisplayName("Property loops")
    class PropertyLoops {

        @Test
        @DisplayName("{a: loop, b: 1, c: loop} gives one copy array [a, c] followed by b")
        void loopPropertiesAreGroupedIntoOneCopyArray() throws IOException {
            ObjectSyntax properties = object(
                    property("a", forLoop("x", variableAccess("xs"), variableAccess("x"))),
                    property("b", integer(1)),
                    property("c", forLoop("y", "yi", variableAccess("xs"), variableAccess("yi"))));
            TestSemanticModel model = bindProperties(properties);

            JsonNode node = EmitHarness.emitObject(
                    ProgramFixture.context(model), emitter -> emitter.emitObjectProperties(properties));

            assertThat(node.fieldNames()).toIterable().containsExactly("copy", "b");
            JsonNode copy = node.get("copy");
            assertThat(copy.size()).isEqualTo(2);
            assertThat(copy.get(0).get("name").asText()).isEqualTo("a");
            assertThat(copy.get(0).get("count").asText()).isEqualTo("[length(parameters('xs'))]");
            assertThat(copy.get(0).get("input").asText()).isEqualTo("[parameters('xs')[copyIndex('a')]]");
            assertThat(copy.get(1).get("name").asText()).isEqualTo("c");
            assertThat(copy.get(1).get("input").asText()).isEqualTo("[copyIndex('c')]");
            assertThat(node.get("b").asLong()).isEqualTo(1);
            copy.forEach(CopyLoopEmissionTest::assertValidCopyObject);
        }

        @Test
        void objectBodyIsWrittenDirectly() throws IOException {
            ObjectSyntax properties = object(property(
                    "disks",
                    forLoop("d", "di", variableAccess("xs"), object(
                            property("lun", variableAccess("di")), property("size", integer(128))))));
            TestSemanticModel model = bindProperties(properties);

            JsonNode node = EmitHarness.emitObject(
                    ProgramFixture.context(model), emitter -> emitter.emitObjectProperties(properties));

            JsonNode input = node.get("copy").get(0).get("input");
            assertThat(input.isObject()).isTrue();
            assertThat(input.get("lun").asText()).isEqualTo("[copyIndex('disks')]");
            assertThat(input.get("size").asLong()).isEqualTo(128);
        }

        @Test
        void literalStringBodyIsWrittenDirectly() throws IOException {
            ObjectSyntax properties = object(property("names", forLoop("x", variableAccess("xs"), string("fixed"))));
            TestSemanticModel model = bindProperties(properties);

            JsonNode node = EmitHarness.emitObject(
                    ProgramFixture.context(model), emitter -> emitter.emitObjectProperties(properties));

            assertThat(node.get("copy").get(0).get("input").asText()).isEqualTo("fixed");
        }

        @Test
        void integerBodyIsWrappedAsExpression() throws IOException {
            ObjectSyntax properties = object(property("ones", forLoop("x", variableAccess("xs"), integer(1))));
            TestSemanticModel model = bindProperties(properties);

            JsonNode node = EmitHarness.emitObject(
                    ProgramFixture.context(model), emitter -> emitter.emitObjectProperties(properties));

            assertThat(node.get("copy").get(0).get("input").asText()).isEqualTo("[int('1')]");
        }
    }

    @Nested
    @DisplayName("Loop count")
    class LoopCount {

        private final TemplateExpressionEvaluator evaluator = new TemplateExpressionEvaluator(
                Map.of("xs", JsonNodeFactory.instance.arrayNode().add(1).add(2).add(3)), Map.of());

        private JsonNode emitVariableLoop(SyntaxBase source) throws IOException {
            ForSyntax loop = forLoop("x", source, variableAccess("x"));
            TestSemanticModel model = ProgramFixture.bind(variable("values", loop));
            return EmitHarness.emitValue(
                    ProgramFixture.context(model), emitter -> emitter.emitCopyObject("values", loop, loop.body()));
        }

        @Test
        void parameterSourceEvaluatesToItsLength() throws IOException {
            JsonNode copy = emitVariableLoop(variableAccess("xs"));

            assertThat(evaluator.evaluate(copy.get("count").asText()).asInt()).isEqualTo(3);
            assertThat(copy.get("input").asText()).isEqualTo("[parameters('xs')[copyIndex('values')]]");
            assertValidCopyObject(copy);
        }

        @Test
        void literalArraySourceEvaluatesToItsLength() throws IOException {
            JsonNode copy = emitVariableLoop(array(integer(1), integer(2), integer(3), integer(4)));

            assertThat(copy.get("count").asText()).isEqualTo("[length(createArray(1, 2, 3, 4))]");
            assertThat(evaluator.evaluate(copy.get("count").asText()).asInt()).isEqualTo(4);
        }

        @Test
        void rangeSourceEvaluatesToItsLength() throws IOException {
            JsonNode copy = emitVariableLoop(call("range", integer(0), integer(5)));

            assertThat(evaluator.evaluate(copy.get("count").asText()).asInt()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("Resource loops")
    class ResourceLoops {

        @Test
        void serialBatchWritesModeAndBatchSize() throws IOException {
            TestSemanticModel model = ProgramFixture.bind();
            ForSyntax loop = (ForSyntax) model.resource("sa").symbol().declaringSyntax().value();
            ForLoopOperation operation = (ForLoopOperation) new OperationBuilder(ProgramFixture.context(model)).build(loop);

            JsonNode copy = EmitHarness.emitValue(
                    ProgramFixture.context(model), emitter -> emitter.emitCopyObject("sa", operation, null, null, 2L));

            assertThat(copy.get("name").asText()).isEqualTo("sa");
            assertThat(copy.get("count").asText()).isEqualTo("[length(parameters('xs'))]");
            assertThat(copy.get("mode").asText()).isEqualTo("serial");
            assertThat(copy.get("batchSize").isIntegralNumber()).isTrue();
            assertThat(copy.get("batchSize").asInt()).isEqualTo(2);
            assertThat(copy.has("input")).isFalse();
            assertValidCopyObject(copy);
        }
    }

    @Nested
    @DisplayName("Copy index override")
    class CopyIndexOverride {

        private ForSyntax innerLoop;
        private TestSemanticModel model;

        /** resource res = [for (r, ri) in xs: { name: r, properties: { items: [for (p, pi) in xs: {...}] } }] */
        private void bindNestedLoops() {
            innerLoop = forLoop("p", "pi", variableAccess("xs"), object(
                    property("idx", variableAccess("pi")), property("outer", variableAccess("ri"))));
            ForSyntax outerLoop = forLoop("r", "ri", variableAccess("xs"), object(
                    property("name", variableAccess("r")),
                    property("properties", object(property("items", innerLoop)))));
            model = ProgramFixture.bind(resource("res", RESOURCE_TYPE, outerLoop));
        }

        @Test
        void withoutOverrideInnerLocalsUseThePropertyName() throws IOException {
            bindNestedLoops();
            ForLoopOperation loop = (ForLoopOperation) new OperationBuilder(ProgramFixture.context(model)).build(innerLoop);

            JsonNode copy = EmitHarness.emitValue(
                    ProgramFixture.context(model), emitter -> emitter.emitCopyObject("items", loop, loop.body()));

            assertThat(copy.get("input").get("idx").asText()).isEqualTo("[copyIndex('items')]");
            assertThat(copy.get("input").get("outer").asText()).isEqualTo("[copyIndex()]");
        }

        @Test
        @DisplayName("Override renames the desugared loop's index and leaves other loops alone")
        void overrideOnlyTouchesTheDesugaredLoop() throws IOException {
            bindNestedLoops();
            ForLoopOperation loop = (ForLoopOperation) new OperationBuilder(ProgramFixture.context(model)).build(innerLoop);

            JsonNode copy = EmitHarness.emitValue(
                    ProgramFixture.context(model),
                    emitter -> emitter.emitCopyObject("items", loop, loop.body(), "custom", null));

            assertThat(copy.get("input").asText())
                    .isEqualTo("[createObject('idx', copyIndex('custom'), 'outer', copyIndex())]");
            assertValidCopyObject(copy);
        }

        @Test
        void syntaxOverloadAppliesOverrideToo() throws IOException {
            bindNestedLoops();

            JsonNode copy = EmitHarness.emitValue(
                    ProgramFixture.context(model),
                    emitter -> emitter.emitCopyObject("items", innerLoop, innerLoop.body(), "custom", null));

            assertThat(copy.get("count").asText()).isEqualTo("[length(parameters('xs'))]");
            assertThat(copy.get("input").asText())
                    .isEqualTo("[createObject('idx', copyIndex('custom'), 'outer', copyIndex())]");
        }

        @Test
        void nestedLoopUnderOverrideIsRejected() {
            ForSyntax nested = forLoop("q", variableAccess("xs"), variableAccess("q"));
            ForSyntax loop = forLoop("p", variableAccess("xs"), object(property("inner", nested)));
            TestSemanticModel bound = ProgramFixture.bind(variable("v", loop));
            ForLoopOperation operation = (ForLoopOperation) new OperationBuilder(ProgramFixture.context(bound)).build(loop);

            assertThatThrownBy(() -> EmitHarness.emitValue(
                            ProgramFixture.context(bound),
                            emitter -> emitter.emitCopyObject("v", operation, operation.body(), "custom", null)))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessageContaining("overridden copy index");
        }
    }
}
