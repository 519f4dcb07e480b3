package io.templateemit.core.engine;

import com.fasterxml.jackson.core.JsonGenerator;
import io.templateemit.core.error.SecretReferenceException;
import io.templateemit.core.error.UnsupportedConstructException;
import io.templateemit.core.expression.ExpressionSerializer;
import io.templateemit.core.expression.FunctionExpression;
import io.templateemit.core.expression.TargetExpression;
import io.templateemit.core.expression.TokenExpression;
import io.templateemit.core.operation.ArrayOperation;
import io.templateemit.core.operation.ConstantValueOperation;
import io.templateemit.core.operation.ExpressionOperation;
import io.templateemit.core.operation.ForLoopOperation;
import io.templateemit.core.operation.NullValueOperation;
import io.templateemit.core.operation.ObjectOperation;
import io.templateemit.core.operation.ObjectPropertyOperation;
import io.templateemit.core.operation.Operation;
import io.templateemit.core.semantics.ModuleSymbol;
import io.templateemit.core.semantics.ResourceMetadata;
import io.templateemit.core.syntax.ForSyntax;
import io.templateemit.core.syntax.InstanceFunctionCallSyntax;
import io.templateemit.core.syntax.ObjectPropertySyntax;
import io.templateemit.core.syntax.ObjectSyntax;
import io.templateemit.core.syntax.StringSyntax;
import io.templateemit.core.syntax.SyntaxBase;
import io.templateemit.core.syntax.SyntaxHelper;
import io.templateemit.core.syntax.SyntaxHelper.ArrayAccessParts;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes template values into a Jackson {@link JsonGenerator}.
 *
 * <p>Literal values are written natively (numbers stay numbers), loops become {@code copy} objects
 * and everything else is converted into a bracketed expression string. The emitter drives the
 * generator but never flushes or closes it; the caller owns the underlying stream.
 *
 * <p>Instances are single-threaded. The {@link EmitterContext} is read-only and may be shared.
 */
public final class ExpressionEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEmitter.class);

    /** Writes one JSON value. */
    @FunctionalInterface
    public interface ValueWriter {
        void write() throws IOException;
    }

    private final JsonGenerator writer;
    private final EmitterContext context;
    private final ExpressionConverter converter;
    private final OperationBuilder operationBuilder;

    public ExpressionEmitter(JsonGenerator writer, EmitterContext context) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.converter = new ExpressionConverter(context);
        this.operationBuilder = new OperationBuilder(context);
    }

    public EmitterContext context() {
        return context;
    }

    // --- Values ---

    /** Builds the operation for {@code syntax} and writes it. */
    public void emitExpression(SyntaxBase syntax) throws IOException {
        emitOperation(operationBuilder.build(syntax));
    }

    /** Writes an operation as a JSON value. */
    public void emitOperation(Operation operation) throws IOException {
        if (operation instanceof ConstantValueOperation constant) {
            Object value = constant.value();
            if (value instanceof Boolean bool) {
                writer.writeBoolean(bool);
            } else if (value instanceof Long number) {
                writer.writeNumber(number);
            } else {
                writeExpression(converter.convertOperation(operation));
            }
        } else if (operation instanceof NullValueOperation) {
            writer.writeNull();
        } else if (operation instanceof ObjectOperation object) {
            writer.writeStartObject();
            emitObjectProperties(object);
            writer.writeEndObject();
        } else if (operation instanceof ArrayOperation array) {
            writer.writeStartArray();
            for (Operation item : array.items()) {
                emitOperation(item);
            }
            writer.writeEndArray();
        } else {
            emitLanguageExpression(converter.convertOperation(operation));
        }
    }

    /** Writes {@code nameSyntax} as it evaluates at {@code newContext}. */
    public void emitExpression(SyntaxBase nameSyntax, SyntaxBase indexExpression, SyntaxBase newContext)
            throws IOException {
        ExpressionConverter view =
                converter.createConverterForIndexReplacement(nameSyntax, indexExpression, newContext);
        writeExpression(view.convertExpression(nameSyntax));
    }

    // --- Resource references ---

    public void emitUnqualifiedResourceId(ResourceMetadata resource, SyntaxBase indexExpression, SyntaxBase newContext)
            throws IOException {
        ExpressionConverter view =
                converter.createConverterForIndexReplacement(resource.nameSyntax(), indexExpression, newContext);
        writeExpression(view.getUnqualifiedResourceId(resource));
    }

    public void emitIndexedSymbolReference(
            ResourceMetadata resource, SyntaxBase indexExpression, SyntaxBase newContext) throws IOException {
        ExpressionConverter view =
                converter.createConverterForIndexReplacement(resource.nameSyntax(), indexExpression, newContext);
        writeExpression(view.generateSymbolicReference(resource.symbol().name(), indexExpression));
    }

    public void emitIndexedSymbolReference(ModuleSymbol module, SyntaxBase indexExpression, SyntaxBase newContext)
            throws IOException {
        ExpressionConverter view = converter.createConverterForIndexReplacement(
                ExpressionConverter.getModuleNameSyntax(module), indexExpression, newContext);
        writeExpression(view.generateSymbolicReference(module.name(), indexExpression));
    }

    public void emitResourceIdReference(ResourceMetadata resource, SyntaxBase indexExpression, SyntaxBase newContext)
            throws IOException {
        ExpressionConverter view =
                converter.createConverterForIndexReplacement(resource.nameSyntax(), indexExpression, newContext);
        writeExpression(view.getFullyQualifiedResourceId(resource));
    }

    public void emitResourceIdReference(ModuleSymbol module, SyntaxBase indexExpression, SyntaxBase newContext)
            throws IOException {
        ExpressionConverter view = converter.createConverterForIndexReplacement(
                ExpressionConverter.getModuleNameSyntax(module), indexExpression, newContext);
        writeExpression(view.getFullyQualifiedResourceId(module));
    }

    /**
     * Writes a dependency on a resource in the reference style selected by {@link
     * io.templateemit.core.config.EmitterSettings#symbolicNameCodegen()}.
     */
    public void emitDependencyReference(ResourceMetadata resource, SyntaxBase indexExpression, SyntaxBase newContext)
            throws IOException {
        if (context.settings().symbolicNameCodegen()) {
            emitIndexedSymbolReference(resource, indexExpression, newContext);
        } else {
            emitResourceIdReference(resource, indexExpression, newContext);
        }
    }

    public void emitDependencyReference(ModuleSymbol module, SyntaxBase indexExpression, SyntaxBase newContext)
            throws IOException {
        if (context.settings().symbolicNameCodegen()) {
            emitIndexedSymbolReference(module, indexExpression, newContext);
        } else {
            emitResourceIdReference(module, indexExpression, newContext);
        }
    }

    public TargetExpression getFullyQualifiedResourceName(ResourceMetadata resource) {
        return converter.getFullyQualifiedResourceName(resource);
    }

    public TargetExpression getManagementGroupResourceId(
            SyntaxBase managementGroupName, SyntaxBase indexExpression, SyntaxBase newContext, boolean fullyQualified) {
        return converter
                .createConverterForIndexReplacement(managementGroupName, indexExpression, newContext)
                .generateManagementGroupResourceId(managementGroupName, fullyQualified);
    }

    // --- Copy loops ---

    public void emitCopyObject(String name, ForLoopOperation loop, Operation input) throws IOException {
        emitCopyObject(name, loop, input, null, null);
    }

    /**
     * Writes a {@code copy} object: {@code name}, {@code count}, optional {@code mode}/{@code batchSize}
     * and {@code input}.
     *
     * @param name copy name, or {@code null}
     * @param loop the loop being desugared
     * @param input per-iteration value, or {@code null} for resource and module loops
     * @param copyIndexOverride copy index name forced on the loop's locals, or {@code null}
     * @param batchSize serial batch size, or {@code null} for parallel
     */
    public void emitCopyObject(
            String name, ForLoopOperation loop, Operation input, String copyIndexOverride, Long batchSize)
            throws IOException {
        ExpressionConverter loopConverter = copyIndexOverride != null
                ? converter.withCopyIndexOverride(loop.syntax(), copyIndexOverride)
                : converter;

        writer.writeStartObject();
        if (name != null) {
            emitProperty("name", name);
        }
        emitPropertyWithTransform("count", loop.expression(), loopConverter, ExpressionEmitter::length);
        emitBatchSize(batchSize);
        if (input != null) {
            boolean direct = canEmitAsInputDirectly(input);
            if (copyIndexOverride == null) {
                if (direct) {
                    emitProperty("input", () -> emitOperation(input));
                } else {
                    emitPropertyWithTransform(
                            "input", input, loopConverter, ExpressionConverter::asFunctionExpression);
                }
            } else {
                rejectNestedLoop(input, loop.syntax());
                emitPropertyWithTransform(
                        "input",
                        input,
                        loopConverter,
                        expression -> direct ? expression : ExpressionConverter.asFunctionExpression(expression));
            }
        }
        writer.writeEndObject();
        LOG.debug(
                "Copy loop emitted: name={}, batch_size={}, copy_index_override={}",
                name,
                batchSize,
                copyIndexOverride);
    }

    public void emitCopyObject(String name, ForSyntax loop, SyntaxBase input) throws IOException {
        emitCopyObject(name, loop, input, null, null);
    }

    /** Syntax-level variant of {@link #emitCopyObject(String, ForLoopOperation, Operation, String, Long)}. */
    public void emitCopyObject(String name, ForSyntax loop, SyntaxBase input, String copyIndexOverride, Long batchSize)
            throws IOException {
        ExpressionConverter loopConverter =
                copyIndexOverride != null ? converter.withCopyIndexOverride(loop, copyIndexOverride) : converter;

        writer.writeStartObject();
        if (name != null) {
            emitProperty("name", name);
        }
        emitPropertyInternal(
                TokenExpression.of("count"),
                () -> writeExpression(length(loopConverter.convertExpression(loop.expression()))));
        emitBatchSize(batchSize);
        if (input != null) {
            boolean direct = canEmitAsInputDirectly(input);
            if (copyIndexOverride == null) {
                if (direct) {
                    emitProperty("input", input);
                } else {
                    emitPropertyInternal(
                            TokenExpression.of("input"),
                            () -> writeExpression(
                                    ExpressionConverter.asFunctionExpression(converter.convertExpression(input))));
                }
            } else {
                rejectNestedLoop(input, loop);
                TargetExpression converted = loopConverter.convertExpression(input);
                emitPropertyInternal(
                        TokenExpression.of("input"),
                        () -> writeExpression(direct ? converted : ExpressionConverter.asFunctionExpression(converted)));
            }
        }
        writer.writeEndObject();
        LOG.debug(
                "Copy loop emitted: name={}, batch_size={}, copy_index_override={}",
                name,
                batchSize,
                copyIndexOverride);
    }

    private void emitBatchSize(Long batchSize) throws IOException {
        if (batchSize != null) {
            emitProperty("mode", LanguageConstants.SERIAL_MODE);
            emitProperty("batchSize", () -> writer.writeNumber(batchSize));
        }
    }

    private static boolean canEmitAsInputDirectly(Operation input) {
        if (input instanceof ObjectOperation) {
            return true;
        }
        return input instanceof ConstantValueOperation constant && constant.value() instanceof String;
    }

    private static boolean canEmitAsInputDirectly(SyntaxBase input) {
        return input instanceof ObjectSyntax || (input instanceof StringSyntax string && !string.isInterpolated());
    }

    private static void rejectNestedLoop(Operation input, ForSyntax loop) {
        Deque<Operation> pending = new ArrayDeque<>();
        pending.push(input);
        while (!pending.isEmpty()) {
            Operation current = pending.pop();
            if (current instanceof ForLoopOperation nested) {
                throw nestedLoopUnderOverride(nested.syntax());
            } else if (current instanceof ObjectOperation object) {
                for (ObjectPropertyOperation property : object.properties()) {
                    pending.push(property.key());
                    pending.push(property.value());
                }
            } else if (current instanceof ArrayOperation array) {
                array.items().forEach(pending::push);
            } else if (current instanceof ExpressionOperation expression) {
                rejectNestedLoop(expression.syntax(), loop);
            }
        }
    }

    private static void rejectNestedLoop(SyntaxBase input, ForSyntax loop) {
        Deque<SyntaxBase> pending = new ArrayDeque<>();
        pending.push(input);
        while (!pending.isEmpty()) {
            SyntaxBase current = pending.pop();
            if (current instanceof ForSyntax nested && nested != loop) {
                throw nestedLoopUnderOverride(nested);
            }
            current.children().forEach(pending::push);
        }
    }

    private static UnsupportedConstructException nestedLoopUnderOverride(ForSyntax nested) {
        return new UnsupportedConstructException(
                "Loops nested inside a loop with an overridden copy index are not supported",
                nested.kind(),
                nested.span());
    }

    private static FunctionExpression length(TargetExpression source) {
        return FunctionExpression.of(LanguageConstants.LENGTH_FUNCTION, source);
    }

    // --- Object properties ---

    public void emitObjectProperties(ObjectSyntax object) throws IOException {
        emitObjectProperties(object, Set.of());
    }

    /**
     * Writes the properties of {@code object}: a single {@code copy} array for loop-valued
     * properties first, then every other property in source order. Properties named in {@code
     * propertiesToOmit} are skipped.
     */
    public void emitObjectProperties(ObjectSyntax object, Set<String> propertiesToOmit) throws IOException {
        List<ObjectPropertyOperation> properties = new ArrayList<>();
        for (ObjectPropertySyntax property : object.properties()) {
            String keyText = property.tryGetKeyText();
            if (keyText != null && propertiesToOmit.contains(keyText)) {
                continue;
            }
            properties.add(operationBuilder.buildProperty(property));
        }
        emitObjectProperties(new ObjectOperation(properties));
    }

    private void emitObjectProperties(ObjectOperation object) throws IOException {
        List<ObjectPropertyOperation> loops = new ArrayList<>();
        List<ObjectPropertyOperation> others = new ArrayList<>();
        for (ObjectPropertyOperation property : object.properties()) {
            (property.value() instanceof ForLoopOperation ? loops : others).add(property);
        }

        if (!loops.isEmpty()) {
            emitProperty(LanguageConstants.COPY_PROPERTY, () -> {
                writer.writeStartArray();
                for (ObjectPropertyOperation property : loops) {
                    ForLoopOperation loop = (ForLoopOperation) property.value();
                    String keyName = property.tryGetKeyText();
                    if (keyName == null) {
                        throw new UnsupportedConstructException(
                                "Loops are not supported under computed property names",
                                loop.syntax().kind(),
                                loop.syntax().span());
                    }
                    emitCopyObject(keyName, loop, loop.body());
                }
                writer.writeEndArray();
            });
        }

        for (ObjectPropertyOperation property : others) {
            String keyText = property.tryGetKeyText();
            if (keyText != null) {
                emitProperty(keyText, () -> emitOperation(property.value()));
            } else {
                emitPropertyInternal(
                        converter.convertOperation(property.key()), () -> emitOperation(property.value()));
            }
        }
    }

    // --- Module parameters ---

    /**
     * Writes the value of one module parameter: a key vault {@code reference} object when the value
     * is a {@code getSecret} call on a key vault, otherwise a {@code value} property.
     *
     * @throws SecretReferenceException when {@code getSecret} is called on anything but a key vault
     */
    public void emitModuleParameterValue(SyntaxBase value) throws IOException {
        if (value instanceof InstanceFunctionCallSyntax call
                && LanguageConstants.GET_SECRET_FUNCTION.equals(call.name())) {
            emitSecretReference(call);
            return;
        }
        emitProperty("value", value);
    }

    private void emitSecretReference(InstanceFunctionCallSyntax call) throws IOException {
        ArrayAccessParts parts = SyntaxHelper.unwrapArrayAccess(call.baseExpression());
        ResourceMetadata keyVault = context.semanticModel()
                .tryLookupResource(parts.baseSyntax())
                .filter(resource -> resource.typeReference().isKeyVault())
                .orElseThrow(() -> new SecretReferenceException(
                        "Cannot emit parameter's KeyVault secret reference.", call.span()));
        int arguments = call.arguments().size();
        if (arguments < 1 || arguments > 2) {
            throw new SecretReferenceException(
                    "Cannot emit parameter's KeyVault secret reference: expected a secret name and an optional"
                            + " version, got " + arguments + " arguments.",
                    call.span());
        }

        TargetExpression keyVaultId = converter
                .createConverterForIndexReplacement(keyVault.nameSyntax(), parts.indexExpression(), call)
                .getFullyQualifiedResourceId(keyVault);

        emitProperty("reference", () -> {
            writer.writeStartObject();
            emitProperty("keyVault", () -> {
                writer.writeStartObject();
                emitProperty("id", keyVaultId);
                writer.writeEndObject();
            });
            emitProperty("secretName", call.arguments().get(0));
            if (arguments == 2) {
                emitProperty("secretVersion", call.arguments().get(1));
            }
            writer.writeEndObject();
        });
        LOG.debug("Key vault secret reference emitted: key_vault={}", keyVault.symbol().name());
    }

    // --- Properties ---

    public void emitProperty(String name, ValueWriter valueWriter) throws IOException {
        emitPropertyInternal(TokenExpression.of(name), valueWriter);
    }

    /** Writes a string property; a value starting with {@code [} is escaped. */
    public void emitProperty(String name, String value) throws IOException {
        emitPropertyInternal(TokenExpression.of(name), () -> writeExpression(TokenExpression.of(value)));
    }

    public void emitProperty(String name, TargetExpression expression) throws IOException {
        emitPropertyInternal(TokenExpression.of(name), () -> emitLanguageExpression(expression));
    }

    public void emitProperty(String name, SyntaxBase value) throws IOException {
        emitPropertyInternal(TokenExpression.of(name), () -> emitExpression(value));
    }

    public void emitProperty(SyntaxBase key, SyntaxBase value) throws IOException {
        emitPropertyInternal(converter.convertExpression(key), () -> emitExpression(value));
    }

    /** Converts {@code value}, applies {@code transform} and writes the result as an expression. */
    public void emitPropertyWithTransform(String name, SyntaxBase value, UnaryOperator<TargetExpression> transform)
            throws IOException {
        emitPropertyInternal(
                TokenExpression.of(name), () -> writeExpression(transform.apply(converter.convertExpression(value))));
    }

    public void emitPropertyWithTransform(String name, Operation value, UnaryOperator<TargetExpression> transform)
            throws IOException {
        emitPropertyWithTransform(name, value, converter, transform);
    }

    private void emitPropertyWithTransform(
            String name,
            Operation value,
            ExpressionConverter valueConverter,
            UnaryOperator<TargetExpression> transform)
            throws IOException {
        emitPropertyInternal(
                TokenExpression.of(name),
                () -> writeExpression(transform.apply(valueConverter.convertOperation(value))));
    }

    /** Writes {@code name} only when {@code value} is present. */
    public void emitOptionalPropertyExpression(String name, SyntaxBase value) throws IOException {
        if (value != null) {
            emitProperty(name, value);
        }
    }

    private void emitPropertyInternal(TargetExpression key, ValueWriter valueWriter) throws IOException {
        writer.writeFieldName(ExpressionSerializer.serialize(key));
        valueWriter.write();
    }

    // --- Leaves ---

    /** Integer tokens are written as numbers, everything else as serialized expression text. */
    private void emitLanguageExpression(TargetExpression expression) throws IOException {
        if (expression instanceof TokenExpression token && token.isInteger()) {
            writer.writeNumber(token.longValue());
            return;
        }
        writeExpression(expression);
    }

    private void writeExpression(TargetExpression expression) throws IOException {
        writer.writeString(ExpressionSerializer.serialize(expression));
    }
}
