package io.templateemit.core.engine;

import static io.templateemit.core.syntax.SyntaxFactory.forLoop;
import static io.templateemit.core.syntax.SyntaxFactory.instanceCall;
import static io.templateemit.core.syntax.SyntaxFactory.integer;
import static io.templateemit.core.syntax.SyntaxFactory.module;
import static io.templateemit.core.syntax.SyntaxFactory.object;
import static io.templateemit.core.syntax.SyntaxFactory.property;
import static io.templateemit.core.syntax.SyntaxFactory.string;
import static io.templateemit.core.syntax.SyntaxFactory.variable;
import static io.templateemit.core.syntax.SyntaxFactory.variableAccess;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.templateemit.core.config.EmitterSettingsLoader;
import io.templateemit.core.syntax.ForSyntax;
import io.templateemit.core.syntax.SyntaxBase;
import io.templateemit.core.testkit.EmitHarness;
import io.templateemit.core.testkit.ProgramFixture;
import io.templateemit.core.testkit.TestSemanticModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/**
 * Log entries written during emission use {@code key=value} fields and never carry secret names or
 * other emitted values.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private List<Logger> loggers;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        logAppender = new ListAppender<>();
        logAppender.start();
        loggers = Stream.of(ExpressionEmitter.class, ExpressionConverter.class, EmitterSettingsLoader.class)
                .map(type -> (Logger) LoggerFactory.getLogger(type))
                .collect(Collectors.toList());
        loggers.forEach(logger -> logger.addAppender(logAppender));
    }

    @AfterEach
    void tearDown() {
        loggers.forEach(logger -> logger.detachAppender(logAppender));
        logAppender.stop();
    }

    private List<String> messages(Level level) {
        return logAppender.list.stream()
                .filter(event -> event.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Copy loop emission logs the loop name and batch size")
    void copyLoopIsLogged() throws IOException {
        ForSyntax loop = forLoop("x", variableAccess("xs"), object(property("v", variableAccess("x"))));
        TestSemanticModel model = ProgramFixture.bind(variable("values", loop));

        EmitHarness.emitObjectText(
                ProgramFixture.context(model), emitter -> emitter.emitCopyObject("values", loop, loop.body(), null, 2L));

        assertThat(messages(Level.DEBUG))
                .contains("Copy loop emitted: name=values, batch_size=2, copy_index_override=null");
    }

    @Test
    @DisplayName("Secret references log the vault symbol but not the secret name")
    void secretNameIsNotLogged() throws IOException {
        SyntaxBase value = instanceCall(variableAccess("kv"), "getSecret", string("topSecretName"));
        TestSemanticModel model = ProgramFixture.bind(module(
                "secrets",
                "./m.bicep",
                object(property("name", string("d2")), property("params", object(property("pw", value))))));

        EmitHarness.emitObjectText(ProgramFixture.context(model), emitter -> emitter.emitModuleParameterValue(value));

        assertThat(messages(Level.DEBUG)).contains("Key vault secret reference emitted: key_vault=kv");
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .noneMatch(message -> message.contains("topSecretName"));
    }

    @Test
    void indexReplacementViewIsLogged() throws IOException {
        TestSemanticModel model = ProgramFixture.bind();
        var sa = model.resource("sa");
        SyntaxBase context = model.resource("kv").symbol().declaringSyntax();

        EmitHarness.emitValueText(
                ProgramFixture.context(model), emitter -> emitter.emitResourceIdReference(sa, integer(1), context));

        assertThat(messages(Level.DEBUG))
                .anyMatch(message -> message.startsWith("Index replacement view created: locals=1, context=ResourceDeclarationSyntax"));
    }

    @Test
    void settingsLoadIsLoggedAtInfo() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{\"experimentalFeaturesEnabled\": {\"symbolicNameCodegen\": true}}");

        EmitterSettingsLoader.load(file, Map.<String, String>of()::get);

        assertThat(messages(Level.INFO))
                .containsExactly("Emitter settings loaded: source=" + file
                        + ", symbolic_name_codegen=true, module_api_version=2020-10-01");
    }
}
