package io.templateemit.core.engine;

import io.templateemit.core.error.UnsupportedConstructException;
import io.templateemit.core.operation.ArrayOperation;
import io.templateemit.core.operation.ConstantValueOperation;
import io.templateemit.core.operation.ExpressionOperation;
import io.templateemit.core.operation.ForLoopOperation;
import io.templateemit.core.operation.NullValueOperation;
import io.templateemit.core.operation.ObjectOperation;
import io.templateemit.core.operation.ObjectPropertyOperation;
import io.templateemit.core.operation.Operation;
import io.templateemit.core.semantics.VariableSymbol;
import io.templateemit.core.syntax.ArrayAccessSyntax;
import io.templateemit.core.syntax.ArraySyntax;
import io.templateemit.core.syntax.BinaryOperationSyntax;
import io.templateemit.core.syntax.BooleanLiteralSyntax;
import io.templateemit.core.syntax.ForSyntax;
import io.templateemit.core.syntax.FunctionCallSyntax;
import io.templateemit.core.syntax.InstanceFunctionCallSyntax;
import io.templateemit.core.syntax.IntegerLiteralSyntax;
import io.templateemit.core.syntax.NullLiteralSyntax;
import io.templateemit.core.syntax.ObjectPropertySyntax;
import io.templateemit.core.syntax.ObjectSyntax;
import io.templateemit.core.syntax.ParenthesizedExpressionSyntax;
import io.templateemit.core.syntax.PropertyAccessSyntax;
import io.templateemit.core.syntax.ResourceAccessSyntax;
import io.templateemit.core.syntax.StringSyntax;
import io.templateemit.core.syntax.SyntaxBase;
import io.templateemit.core.syntax.TernaryOperationSyntax;
import io.templateemit.core.syntax.UnaryOperationSyntax;
import io.templateemit.core.syntax.VariableAccessSyntax;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers syntax into the {@link Operation} tree the emitter walks.
 *
 * <p>Literal containers and loops keep their structure so they can be written natively; everything
 * else becomes an {@link ExpressionOperation} and is converted to an expression string later.
 * References to inlined variables are replaced by their (recursively built) values and calls to
 * {@code any} are dropped.
 */
public final class OperationBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(OperationBuilder.class);

    private final EmitterContext context;

    public OperationBuilder(EmitterContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    public Operation build(SyntaxBase syntax) {
        Objects.requireNonNull(syntax, "syntax must not be null");

        if (syntax instanceof VariableAccessSyntax access) {
            VariableSymbol inlined = tryGetInlinedVariable(access);
            if (inlined != null) {
                LOG.debug("Inlining variable: name={}", inlined.name());
                return build(inlined.value());
            }
            return new ExpressionOperation(syntax);
        }
        SyntaxBase anyArgument = ExpressionConverter.tryGetAnyArgument(syntax, context.semanticModel());
        if (anyArgument != null) {
            return build(anyArgument);
        }
        if (syntax instanceof BooleanLiteralSyntax bool) {
            return ConstantValueOperation.of(bool.value());
        }
        if (syntax instanceof IntegerLiteralSyntax integer) {
            return ConstantValueOperation.of(integer.value());
        }
        if (syntax instanceof NullLiteralSyntax) {
            return NullValueOperation.INSTANCE;
        }
        if (syntax instanceof StringSyntax string) {
            return string.isInterpolated()
                    ? new ExpressionOperation(string)
                    : ConstantValueOperation.of(string.tryGetLiteralValue());
        }
        if (syntax instanceof ObjectSyntax object) {
            return buildObject(object);
        }
        if (syntax instanceof ArraySyntax array) {
            return buildArray(array);
        }
        if (syntax instanceof ForSyntax loop) {
            return buildLoop(loop);
        }
        if (isExpression(syntax)) {
            return new ExpressionOperation(syntax);
        }
        throw new UnsupportedConstructException(
                "Cannot emit unexpected expression of type " + syntax.kind(), syntax.kind(), syntax.span());
    }

    private ObjectOperation buildObject(ObjectSyntax object) {
        List<ObjectPropertyOperation> properties = new ArrayList<>(object.properties().size());
        for (ObjectPropertySyntax property : object.properties()) {
            properties.add(buildProperty(property));
        }
        return new ObjectOperation(properties);
    }

    ObjectPropertyOperation buildProperty(ObjectPropertySyntax property) {
        String keyText = property.tryGetKeyText();
        Operation key = keyText != null ? ConstantValueOperation.of(keyText) : build(property.key());
        return new ObjectPropertyOperation(key, build(property.value()));
    }

    private ArrayOperation buildArray(ArraySyntax array) {
        List<Operation> items = new ArrayList<>(array.items().size());
        for (SyntaxBase item : array.items()) {
            if (item instanceof ForSyntax loop) {
                throw new UnsupportedConstructException(
                        "Loops are not supported as array items", loop.kind(), loop.span());
            }
            items.add(build(item));
        }
        return new ArrayOperation(items);
    }

    private ForLoopOperation buildLoop(ForSyntax loop) {
        if (loop.body() instanceof ForSyntax nested) {
            throw new UnsupportedConstructException(
                    "Loops are not supported directly inside another loop", nested.kind(), nested.span());
        }
        return new ForLoopOperation(
                build(loop.expression()),
                loop.itemVariable().name(),
                loop.indexVariable() != null ? loop.indexVariable().name() : null,
                build(loop.body()),
                loop);
    }

    private VariableSymbol tryGetInlinedVariable(VariableAccessSyntax access) {
        return context.semanticModel()
                .getSymbolInfo(access)
                .filter(VariableSymbol.class::isInstance)
                .map(VariableSymbol.class::cast)
                .filter(context::isInlined)
                .orElse(null);
    }

    private static boolean isExpression(SyntaxBase syntax) {
        return syntax instanceof ParenthesizedExpressionSyntax
                || syntax instanceof UnaryOperationSyntax
                || syntax instanceof BinaryOperationSyntax
                || syntax instanceof TernaryOperationSyntax
                || syntax instanceof FunctionCallSyntax
                || syntax instanceof InstanceFunctionCallSyntax
                || syntax instanceof ArrayAccessSyntax
                || syntax instanceof PropertyAccessSyntax
                || syntax instanceof ResourceAccessSyntax;
    }
}
