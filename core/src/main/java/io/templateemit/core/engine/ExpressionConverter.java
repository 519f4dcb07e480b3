package io.templateemit.core.engine;

import io.templateemit.core.config.EmitterSettings;
import io.templateemit.core.error.IndexReplacementException;
import io.templateemit.core.error.UnsupportedConstructException;
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
import io.templateemit.core.semantics.FunctionSymbol;
import io.templateemit.core.semantics.LocalVariableKind;
import io.templateemit.core.semantics.LocalVariableSymbol;
import io.templateemit.core.semantics.ModuleSymbol;
import io.templateemit.core.semantics.NamespaceSymbol;
import io.templateemit.core.semantics.ParameterSymbol;
import io.templateemit.core.semantics.ResourceMetadata;
import io.templateemit.core.semantics.ResourceScopeData;
import io.templateemit.core.semantics.ResourceSymbol;
import io.templateemit.core.semantics.ResourceTypeReference;
import io.templateemit.core.semantics.SemanticModel;
import io.templateemit.core.semantics.Symbol;
import io.templateemit.core.semantics.VariableSymbol;
import io.templateemit.core.syntax.ArrayAccessSyntax;
import io.templateemit.core.syntax.ArraySyntax;
import io.templateemit.core.syntax.BinaryOperationSyntax;
import io.templateemit.core.syntax.BooleanLiteralSyntax;
import io.templateemit.core.syntax.ForSyntax;
import io.templateemit.core.syntax.FunctionCallSyntax;
import io.templateemit.core.syntax.IdentifierSyntax;
import io.templateemit.core.syntax.InstanceFunctionCallSyntax;
import io.templateemit.core.syntax.IntegerLiteralSyntax;
import io.templateemit.core.syntax.ModuleDeclarationSyntax;
import io.templateemit.core.syntax.NullLiteralSyntax;
import io.templateemit.core.syntax.ObjectPropertySyntax;
import io.templateemit.core.syntax.ObjectSyntax;
import io.templateemit.core.syntax.OutputDeclarationSyntax;
import io.templateemit.core.syntax.ParenthesizedExpressionSyntax;
import io.templateemit.core.syntax.PropertyAccessSyntax;
import io.templateemit.core.syntax.ResourceAccessSyntax;
import io.templateemit.core.syntax.ResourceDeclarationSyntax;
import io.templateemit.core.syntax.StringSyntax;
import io.templateemit.core.syntax.SyntaxBase;
import io.templateemit.core.syntax.SyntaxHelper;
import io.templateemit.core.syntax.SyntaxHelper.ArrayAccessParts;
import io.templateemit.core.syntax.TernaryOperationSyntax;
import io.templateemit.core.syntax.UnaryOperationSyntax;
import io.templateemit.core.syntax.UnaryOperator;
import io.templateemit.core.syntax.VariableAccessSyntax;
import io.templateemit.core.syntax.VariableDeclarationSyntax;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts source expressions and operations into target-language expressions.
 *
 * <p>A converter is immutable. Views with a different {@link ConversionContext} are derived with
 * {@link #createConverterForIndexReplacement} and {@link #withCopyIndexOverride}; the receiver is
 * never modified, so a view can be used for a single sub-emission and then dropped.
 */
public final class ExpressionConverter {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionConverter.class);

    private final EmitterContext context;
    private final ConversionContext conversion;
    private final LoopScopeAnalyzer loopScopes;

    public ExpressionConverter(EmitterContext context) {
        this(context, ConversionContext.EMPTY);
    }

    private ExpressionConverter(EmitterContext context, ConversionContext conversion) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.conversion = Objects.requireNonNull(conversion, "conversion must not be null");
        this.loopScopes = new LoopScopeAnalyzer(context.semanticModel());
    }

    // --- Views ---

    /**
     * Returns a converter that can emit {@code nameSyntax} at {@code newContext}.
     *
     * <p>If every loop local used by {@code nameSyntax} is still in scope at {@code newContext} the
     * receiver itself is returned. If they all come from one loop and {@code indexExpression} is
     * given, the item local becomes {@code source[index]} and the index local becomes {@code index}.
     *
     * @throws IndexReplacementException when locals of several loops are out of scope, or when an
     *     index is needed but none was supplied
     */
    public ExpressionConverter createConverterForIndexReplacement(
            SyntaxBase nameSyntax, SyntaxBase indexExpression, SyntaxBase newContext) {
        List<LocalVariableSymbol> inaccessible = loopScopes.getInaccessibleLocalsAfterMove(nameSyntax, newContext);
        List<ForSyntax> loops = loopScopes.getDeclaringLoops(inaccessible);
        if (loops.isEmpty()) {
            return this;
        }
        if (loops.size() > 1) {
            throw new IndexReplacementException(
                    "Expression references locals of " + loops.size() + " loops that are not in scope here",
                    loops.size(),
                    newContext.span());
        }
        if (indexExpression == null) {
            throw new IndexReplacementException(
                    "Expression references loop locals that are not in scope here and no index was supplied",
                    1,
                    newContext.span());
        }

        ForSyntax loop = loops.get(0);
        TargetExpression index = convertExpression(indexExpression);
        Map<LocalVariableSymbol, TargetExpression> replacements = new IdentityHashMap<>();
        for (LocalVariableSymbol local : inaccessible) {
            replacements.put(
                    local,
                    local.localKind() == LocalVariableKind.INDEX
                            ? index
                            : asFunctionExpression(convertExpression(loop.expression()))
                                    .appendProperties(index));
        }
        LOG.debug("Index replacement view created: locals={}, context={}", replacements.size(), newContext.kind());
        return new ExpressionConverter(context, conversion.withReplacements(replacements));
    }

    /** Returns a converter in which the locals of {@code loop} use the copy index named {@code copyIndexName}. */
    public ExpressionConverter withCopyIndexOverride(ForSyntax loop, String copyIndexName) {
        Objects.requireNonNull(loop, "loop must not be null");
        Objects.requireNonNull(copyIndexName, "copyIndexName must not be null");
        return new ExpressionConverter(context, conversion.withCopyIndexOverride(loop, copyIndexName));
    }

    // --- Operations ---

    /** Converts an operation into a single expression. Loops cannot be expressed this way. */
    public TargetExpression convertOperation(Operation operation) {
        if (operation instanceof ConstantValueOperation constant) {
            Object value = constant.value();
            if (value instanceof Boolean bool) {
                return booleanExpression(bool);
            }
            if (value instanceof Long number) {
                return TokenExpression.of(number);
            }
            return TokenExpression.of((String) value);
        }
        if (operation instanceof NullValueOperation) {
            return FunctionExpression.of("null");
        }
        if (operation instanceof ObjectOperation object) {
            List<TargetExpression> arguments = new ArrayList<>();
            for (ObjectPropertyOperation property : object.properties()) {
                if (property.value() instanceof ForLoopOperation loop) {
                    throw loopNotSupported(loop.syntax());
                }
                String keyText = property.tryGetKeyText();
                arguments.add(keyText != null ? TokenExpression.of(keyText) : convertOperation(property.key()));
                arguments.add(convertOperation(property.value()));
            }
            return FunctionExpression.of("createObject", arguments);
        }
        if (operation instanceof ArrayOperation array) {
            List<TargetExpression> items = new ArrayList<>();
            for (Operation item : array.items()) {
                items.add(convertOperation(item));
            }
            return FunctionExpression.of("createArray", items);
        }
        if (operation instanceof ForLoopOperation loop) {
            throw loopNotSupported(loop.syntax());
        }
        if (operation instanceof ExpressionOperation expression) {
            return convertExpression(expression.syntax());
        }
        throw new IllegalStateException("Unknown operation: " + operation.getClass().getSimpleName());
    }

    // --- Expressions ---

    public TargetExpression convertExpression(SyntaxBase syntax) {
        Objects.requireNonNull(syntax, "syntax must not be null");
        if (syntax instanceof BooleanLiteralSyntax bool) {
            return booleanExpression(bool.value());
        }
        if (syntax instanceof IntegerLiteralSyntax integer) {
            return TokenExpression.of(integer.value());
        }
        if (syntax instanceof NullLiteralSyntax) {
            return FunctionExpression.of("null");
        }
        if (syntax instanceof IdentifierSyntax identifier) {
            return TokenExpression.of(identifier.name());
        }
        if (syntax instanceof StringSyntax string) {
            return convertString(string);
        }
        if (syntax instanceof ObjectSyntax object) {
            return convertObject(object);
        }
        if (syntax instanceof ArraySyntax array) {
            List<TargetExpression> items = new ArrayList<>();
            for (SyntaxBase item : array.items()) {
                items.add(convertExpression(item));
            }
            return FunctionExpression.of("createArray", items);
        }
        if (syntax instanceof ParenthesizedExpressionSyntax parenthesized) {
            return convertExpression(parenthesized.expression());
        }
        if (syntax instanceof UnaryOperationSyntax unary) {
            return convertUnary(unary);
        }
        if (syntax instanceof BinaryOperationSyntax binary) {
            return convertBinary(binary);
        }
        if (syntax instanceof TernaryOperationSyntax ternary) {
            return FunctionExpression.of(
                    "if",
                    convertExpression(ternary.condition()),
                    convertExpression(ternary.trueExpression()),
                    convertExpression(ternary.falseExpression()));
        }
        if (syntax instanceof FunctionCallSyntax call) {
            return convertFunctionCall(call);
        }
        if (syntax instanceof InstanceFunctionCallSyntax call) {
            return convertInstanceFunctionCall(call);
        }
        if (syntax instanceof ArrayAccessSyntax access) {
            return convertArrayAccess(access);
        }
        if (syntax instanceof PropertyAccessSyntax access) {
            return convertPropertyAccess(access);
        }
        if (syntax instanceof ResourceAccessSyntax access) {
            return convertResourceAccess(access);
        }
        if (syntax instanceof VariableAccessSyntax access) {
            return convertVariableAccess(access);
        }
        if (syntax instanceof ForSyntax loop) {
            throw loopNotSupported(loop);
        }
        throw new UnsupportedConstructException(
                "Cannot emit unexpected expression of type " + syntax.kind(), syntax.kind(), syntax.span());
    }

    private TargetExpression convertString(StringSyntax string) {
        if (!string.isInterpolated()) {
            return TokenExpression.of(string.tryGetLiteralValue());
        }
        List<String> segments = string.segmentValues();
        List<SyntaxBase> expressions = string.expressions();
        StringBuilder format = new StringBuilder();
        List<TargetExpression> arguments = new ArrayList<>();
        arguments.add(null);
        for (int i = 0; i < segments.size(); i++) {
            format.append(segments.get(i).replace("{", "{{").replace("}", "}}"));
            if (i < expressions.size()) {
                format.append('{').append(i).append('}');
                arguments.add(convertExpression(expressions.get(i)));
            }
        }
        arguments.set(0, TokenExpression.of(format.toString()));
        return FunctionExpression.of("format", arguments);
    }

    private TargetExpression convertObject(ObjectSyntax object) {
        List<TargetExpression> arguments = new ArrayList<>();
        for (ObjectPropertySyntax property : object.properties()) {
            if (property.value() instanceof ForSyntax loop) {
                throw loopNotSupported(loop);
            }
            String keyText = property.tryGetKeyText();
            arguments.add(keyText != null ? TokenExpression.of(keyText) : convertExpression(property.key()));
            arguments.add(convertExpression(property.value()));
        }
        return FunctionExpression.of("createObject", arguments);
    }

    private TargetExpression convertUnary(UnaryOperationSyntax unary) {
        if (unary.operator() == UnaryOperator.NOT) {
            return FunctionExpression.of("not", convertExpression(unary.expression()));
        }
        if (unary.expression() instanceof IntegerLiteralSyntax literal) {
            return TokenExpression.of(-literal.value());
        }
        return FunctionExpression.of("sub", TokenExpression.of(0), convertExpression(unary.expression()));
    }

    private TargetExpression convertBinary(BinaryOperationSyntax binary) {
        TargetExpression left = convertExpression(binary.left());
        TargetExpression right = convertExpression(binary.right());
        switch (binary.operator()) {
            case LOGICAL_OR:
                return FunctionExpression.of("or", left, right);
            case LOGICAL_AND:
                return FunctionExpression.of("and", left, right);
            case EQUALS:
                return FunctionExpression.of("equals", left, right);
            case NOT_EQUALS:
                return FunctionExpression.of("not", FunctionExpression.of("equals", left, right));
            case EQUALS_INSENSITIVE:
                return FunctionExpression.of(
                        "equals", FunctionExpression.of("toLower", left), FunctionExpression.of("toLower", right));
            case NOT_EQUALS_INSENSITIVE:
                return FunctionExpression.of(
                        "not",
                        FunctionExpression.of(
                                "equals",
                                FunctionExpression.of("toLower", left),
                                FunctionExpression.of("toLower", right)));
            case LESS_THAN:
                return FunctionExpression.of("less", left, right);
            case LESS_THAN_OR_EQUAL:
                return FunctionExpression.of("lessOrEquals", left, right);
            case GREATER_THAN:
                return FunctionExpression.of("greater", left, right);
            case GREATER_THAN_OR_EQUAL:
                return FunctionExpression.of("greaterOrEquals", left, right);
            case ADD:
                return FunctionExpression.of("add", left, right);
            case SUBTRACT:
                return FunctionExpression.of("sub", left, right);
            case MULTIPLY:
                return FunctionExpression.of("mul", left, right);
            case DIVIDE:
                return FunctionExpression.of("div", left, right);
            case MODULO:
                return FunctionExpression.of("mod", left, right);
            case COALESCE:
                return FunctionExpression.of("coalesce", left, right);
            default:
                throw new UnsupportedConstructException(
                        "Cannot emit unexpected binary operator " + binary.operator(), binary.kind(), binary.span());
        }
    }

    private TargetExpression convertFunctionCall(FunctionCallSyntax call) {
        return convertFunction(call.name(), call.arguments());
    }

    private TargetExpression convertInstanceFunctionCall(InstanceFunctionCallSyntax call) {
        Optional<Symbol> baseSymbol = semanticModel().getSymbolInfo(call.baseExpression());
        if (baseSymbol.isPresent() && baseSymbol.get() instanceof NamespaceSymbol) {
            return convertFunction(call.name(), call.arguments());
        }

        // kv.listKeys() and sa[i].listKeys(): resource id and api version go first
        ArrayAccessParts parts = SyntaxHelper.unwrapArrayAccess(call.baseExpression());
        Optional<ResourceMetadata> resource = semanticModel().tryLookupResource(parts.baseSyntax());
        if (resource.isPresent()) {
            ExpressionConverter view =
                    createConverterForIndexReplacement(resource.get().nameSyntax(), parts.indexExpression(), call);
            List<TargetExpression> arguments = new ArrayList<>();
            arguments.add(view.getFullyQualifiedResourceId(resource.get()));
            String apiVersion = resource.get().typeReference().apiVersion();
            if (apiVersion != null) {
                arguments.add(TokenExpression.of(apiVersion));
            }
            arguments.addAll(convertArguments(call.arguments()));
            return FunctionExpression.of(call.name(), arguments);
        }
        throw new UnsupportedConstructException(
                "Cannot emit instance function '" + call.name() + "' in this position", call.kind(), call.span());
    }

    /** Unqualified calls and namespace-qualified calls share one lowering; {@code any} is dropped. */
    private TargetExpression convertFunction(String name, List<SyntaxBase> arguments) {
        if (LanguageConstants.ANY_FUNCTION.equals(name) && arguments.size() == 1) {
            return convertExpression(arguments.get(0));
        }
        return FunctionExpression.of(name, convertArguments(arguments));
    }

    private List<TargetExpression> convertArguments(List<SyntaxBase> arguments) {
        List<TargetExpression> converted = new ArrayList<>(arguments.size());
        for (SyntaxBase argument : arguments) {
            converted.add(convertExpression(argument));
        }
        return converted;
    }

    private TargetExpression convertArrayAccess(ArrayAccessSyntax access) {
        Optional<ResourceMetadata> resource = semanticModel().tryLookupResource(access.baseExpression());
        if (resource.isPresent() && resource.get().isCollection()) {
            return createConverterForIndexReplacement(resource.get().nameSyntax(), access.indexExpression(), access)
                    .referenceExpression(resource.get(), access.indexExpression(), true);
        }
        Optional<ModuleSymbol> module = lookupModule(access.baseExpression());
        if (module.isPresent() && module.get().isCollection()) {
            return createConverterForIndexReplacement(
                            getModuleNameSyntax(module.get()), access.indexExpression(), access)
                    .moduleReference(module.get(), access.indexExpression(), true);
        }
        return asFunctionExpression(convertExpression(access.baseExpression()))
                .appendProperties(convertExpression(access.indexExpression()));
    }

    private TargetExpression convertPropertyAccess(PropertyAccessSyntax access) {
        // mod.outputs.foo and mod[i].outputs.foo
        if (access.baseExpression() instanceof PropertyAccessSyntax outputs
                && "outputs".equals(outputs.propertyName())) {
            ArrayAccessParts parts = SyntaxHelper.unwrapArrayAccess(outputs.baseExpression());
            Optional<ModuleSymbol> module = lookupModule(parts.baseSyntax());
            if (module.isPresent()) {
                return createConverterForIndexReplacement(
                                getModuleNameSyntax(module.get()), parts.indexExpression(), access)
                        .moduleReference(module.get(), parts.indexExpression(), false)
                        .appendProperties(
                                TokenExpression.of("outputs"),
                                TokenExpression.of(access.propertyName()),
                                TokenExpression.of("value"));
            }
        }

        ArrayAccessParts parts = SyntaxHelper.unwrapArrayAccess(access.baseExpression());
        Optional<ResourceMetadata> resource = semanticModel().tryLookupResource(parts.baseSyntax());
        if (resource.isPresent()) {
            return convertResourceProperty(resource.get(), parts.indexExpression(), access);
        }
        Optional<ModuleSymbol> module = lookupModule(parts.baseSyntax());
        if (module.isPresent()) {
            return convertModuleProperty(module.get(), parts.indexExpression(), access);
        }
        return asFunctionExpression(convertExpression(access.baseExpression()))
                .appendProperties(TokenExpression.of(access.propertyName()));
    }

    private TargetExpression convertResourceProperty(
            ResourceMetadata resource, SyntaxBase indexExpression, PropertyAccessSyntax access) {
        ExpressionConverter view =
                createConverterForIndexReplacement(resource.nameSyntax(), indexExpression, access);
        ResourceTypeReference typeReference = resource.typeReference();
        switch (access.propertyName()) {
            case "id":
                return view.getFullyQualifiedResourceId(resource);
            case "name":
                return view.convertExpression(resource.nameSyntax());
            case "type":
                return TokenExpression.of(typeReference.formatType());
            case "apiVersion":
                if (typeReference.apiVersion() != null) {
                    return TokenExpression.of(typeReference.apiVersion());
                }
                break;
            case "properties":
                return view.referenceExpression(resource, indexExpression, false);
            default:
                break;
        }
        return view.referenceExpression(resource, indexExpression, true)
                .appendProperties(TokenExpression.of(access.propertyName()));
    }

    private TargetExpression convertModuleProperty(
            ModuleSymbol module, SyntaxBase indexExpression, PropertyAccessSyntax access) {
        SyntaxBase nameSyntax = getModuleNameSyntax(module);
        ExpressionConverter view = createConverterForIndexReplacement(nameSyntax, indexExpression, access);
        switch (access.propertyName()) {
            case "name":
                return view.convertExpression(nameSyntax);
            case "id":
                return view.getFullyQualifiedResourceId(module);
            case "outputs":
                return view.moduleReference(module, indexExpression, false)
                        .appendProperties(TokenExpression.of("outputs"));
            default:
                return view.moduleReference(module, indexExpression, true)
                        .appendProperties(TokenExpression.of(access.propertyName()));
        }
    }

    private TargetExpression convertResourceAccess(ResourceAccessSyntax access) {
        ResourceMetadata resource = semanticModel()
                .tryLookupResource(access)
                .orElseThrow(() -> new UnsupportedConstructException(
                        "Cannot resolve nested resource '" + access.resourceName() + "'",
                        access.kind(),
                        access.span()));
        return createConverterForIndexReplacement(resource.nameSyntax(), null, access)
                .referenceExpression(resource, null, true);
    }

    private TargetExpression convertVariableAccess(VariableAccessSyntax access) {
        Symbol symbol = semanticModel()
                .getSymbolInfo(access)
                .orElseThrow(() -> new UnsupportedConstructException(
                        "Cannot resolve symbol '" + access.name() + "'", access.kind(), access.span()));

        if (symbol instanceof ParameterSymbol) {
            return FunctionExpression.of("parameters", TokenExpression.of(symbol.name()));
        }
        if (symbol instanceof VariableSymbol variable) {
            if (context.isInlined(variable)) {
                LOG.debug("Inlining variable: name={}", variable.name());
                return convertExpression(variable.value());
            }
            return FunctionExpression.of("variables", TokenExpression.of(symbol.name()));
        }
        if (symbol instanceof LocalVariableSymbol local) {
            return convertLocalVariable(local);
        }
        if (symbol instanceof ResourceSymbol) {
            ResourceMetadata resource = semanticModel()
                    .tryLookupResource(access)
                    .orElseThrow(() -> new UnsupportedConstructException(
                            "Missing metadata for resource '" + symbol.name() + "'", access.kind(), access.span()));
            return createConverterForIndexReplacement(resource.nameSyntax(), null, access)
                    .referenceExpression(resource, null, true);
        }
        if (symbol instanceof ModuleSymbol module) {
            return createConverterForIndexReplacement(getModuleNameSyntax(module), null, access)
                    .moduleReference(module, null, true);
        }
        throw new UnsupportedConstructException(
                "Cannot emit reference to symbol '" + symbol.name() + "' of kind "
                        + symbol.getClass().getSimpleName(),
                access.kind(),
                access.span());
    }

    private TargetExpression convertLocalVariable(LocalVariableSymbol local) {
        TargetExpression replacement = conversion.replacementFor(local);
        if (replacement != null) {
            return replacement;
        }
        ForSyntax loop = loopScopes.getEnclosingLoop(local);
        FunctionExpression index = copyIndex(resolveCopyIndexName(loop));
        if (local.localKind() == LocalVariableKind.INDEX) {
            return index;
        }
        return asFunctionExpression(convertExpression(loop.expression())).appendProperties(index);
    }

    /**
     * The copy index name of a loop: the override if one was set, the property key for property
     * loops, the variable name for variable loops, and none for resource, module and output loops.
     */
    private String resolveCopyIndexName(ForSyntax loop) {
        String override = conversion.copyIndexOverrideFor(loop);
        if (override != null) {
            return override;
        }
        SyntaxBase parent = semanticModel().getParent(loop).orElse(null);
        if (parent instanceof ObjectPropertySyntax property) {
            String key = property.tryGetKeyText();
            if (key == null) {
                throw new UnsupportedConstructException(
                        "Loops are not supported under computed property names", property.kind(), property.span());
            }
            return key;
        }
        if (parent instanceof VariableDeclarationSyntax variable) {
            return variable.name();
        }
        if (parent instanceof ResourceDeclarationSyntax
                || parent instanceof ModuleDeclarationSyntax
                || parent instanceof OutputDeclarationSyntax) {
            return null;
        }
        throw loopNotSupported(loop);
    }

    // --- References ---

    private FunctionExpression referenceExpression(ResourceMetadata resource, SyntaxBase indexExpression, boolean full) {
        String apiVersion = resource.typeReference().apiVersion();
        List<TargetExpression> arguments = new ArrayList<>();
        if (settings().symbolicNameCodegen()) {
            arguments.add(generateSymbolicReference(resource.symbol().name(), indexExpression));
            if (full) {
                arguments.add(TokenExpression.of(apiVersion != null ? apiVersion : ""));
                arguments.add(TokenExpression.of("full"));
            }
        } else {
            arguments.add(getFullyQualifiedResourceId(resource));
            if (apiVersion != null) {
                arguments.add(TokenExpression.of(apiVersion));
            }
            if (full) {
                arguments.add(TokenExpression.of("full"));
            }
        }
        return FunctionExpression.of("reference", arguments);
    }

    private FunctionExpression moduleReference(ModuleSymbol module, SyntaxBase indexExpression, boolean full) {
        String apiVersion = settings().moduleDeploymentApiVersion();
        List<TargetExpression> arguments = new ArrayList<>();
        if (settings().symbolicNameCodegen()) {
            arguments.add(generateSymbolicReference(module.name(), indexExpression));
            if (full) {
                arguments.add(TokenExpression.of(apiVersion));
                arguments.add(TokenExpression.of("full"));
            }
        } else {
            arguments.add(getFullyQualifiedResourceId(module));
            arguments.add(TokenExpression.of(apiVersion));
            if (full) {
                arguments.add(TokenExpression.of("full"));
            }
        }
        return FunctionExpression.of("reference", arguments);
    }

    /**
     * The symbolic name of a declaration, indexed when {@code indexExpression} is given: {@code 'vm'}
     * or {@code format('vm[{0}]', index)}.
     */
    public TargetExpression generateSymbolicReference(String symbolName, SyntaxBase indexExpression) {
        if (indexExpression == null) {
            return TokenExpression.of(symbolName);
        }
        return FunctionExpression.of(
                "format", TokenExpression.of(symbolName + "[{0}]"), convertExpression(indexExpression));
    }

    public FunctionExpression getFullyQualifiedResourceId(ResourceMetadata resource) {
        return ResourceIdFormatter.fullyQualified(
                this, resource.scopeData(), resource.typeReference().formatType(), getResourceNameSegments(resource));
    }

    public FunctionExpression getFullyQualifiedResourceId(ModuleSymbol module) {
        return ResourceIdFormatter.fullyQualified(
                this,
                ResourceScopeData.of(semanticModel().targetScope()),
                ResourceTypeReference.DEPLOYMENTS_TYPE,
                List.of(convertExpression(getModuleNameSyntax(module))));
    }

    public FunctionExpression getUnqualifiedResourceId(ResourceMetadata resource) {
        return ResourceIdFormatter.unqualified(
                resource.scopeData(), resource.typeReference().formatType(), getResourceNameSegments(resource));
    }

    public FunctionExpression getUnqualifiedResourceId(ModuleSymbol module) {
        return ResourceIdFormatter.unqualified(
                ResourceScopeData.of(semanticModel().targetScope()),
                ResourceTypeReference.DEPLOYMENTS_TYPE,
                List.of(convertExpression(getModuleNameSyntax(module))));
    }

    /** The resource name including parent segments: the bare name, or {@code format('{0}/{1}', ...)}. */
    public TargetExpression getFullyQualifiedResourceName(ResourceMetadata resource) {
        List<TargetExpression> segments = getResourceNameSegments(resource);
        if (segments.size() == 1) {
            return segments.get(0);
        }
        StringBuilder format = new StringBuilder();
        List<TargetExpression> arguments = new ArrayList<>();
        arguments.add(null);
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                format.append('/');
            }
            format.append('{').append(i).append('}');
            arguments.add(segments.get(i));
        }
        arguments.set(0, TokenExpression.of(format.toString()));
        return FunctionExpression.of("format", arguments);
    }

    /**
     * The id of a management group: {@code tenantResourceId(...)} when fully qualified, otherwise a
     * provider-relative path.
     */
    public FunctionExpression generateManagementGroupResourceId(SyntaxBase managementGroupName, boolean fullyQualified) {
        TargetExpression name = convertExpression(managementGroupName);
        if (fullyQualified) {
            return FunctionExpression.of(
                    "tenantResourceId", TokenExpression.of(LanguageConstants.MANAGEMENT_GROUP_TYPE), name);
        }
        return FunctionExpression.of(
                "format",
                TokenExpression.of("/providers/{0}/{1}"),
                TokenExpression.of(LanguageConstants.MANAGEMENT_GROUP_TYPE),
                name);
    }

    private List<TargetExpression> getResourceNameSegments(ResourceMetadata resource) {
        List<TargetExpression> segments = new ArrayList<>();
        if (resource.parent() != null) {
            segments.addAll(getResourceNameSegments(resource.parent()));
        }
        segments.add(convertExpression(resource.nameSyntax()));
        return segments;
    }

    // --- Helpers ---

    /**
     * Wraps a token so that accessors can be appended: integers become {@code int('5')} and strings
     * {@code string('x')}. Function expressions are returned unchanged.
     */
    public static FunctionExpression asFunctionExpression(TargetExpression expression) {
        if (expression instanceof FunctionExpression function) {
            return function;
        }
        TokenExpression token = (TokenExpression) expression;
        if (token.isInteger()) {
            return FunctionExpression.of("int", TokenExpression.of(Long.toString(token.longValue())));
        }
        return FunctionExpression.of("string", token);
    }

    /** The expression bound to a module's {@code name} property. */
    public static SyntaxBase getModuleNameSyntax(ModuleSymbol module) {
        ModuleDeclarationSyntax declaration = module.declaringSyntax();
        ObjectSyntax body = declaration.tryGetBody();
        if (body == null) {
            throw new UnsupportedConstructException(
                    "Module '" + module.name() + "' has no object body", declaration.kind(), declaration.span());
        }
        return body.tryGetProperty("name")
                .map(ObjectPropertySyntax::value)
                .orElseThrow(() -> new UnsupportedConstructException(
                        "Module '" + module.name() + "' has no name property",
                        declaration.kind(),
                        declaration.span()));
    }

    /**
     * The single argument of an {@code any(x)} or {@code sys.any(x)} call, or {@code null} when
     * {@code syntax} is not such a call.
     */
    static SyntaxBase tryGetAnyArgument(SyntaxBase syntax, SemanticModel semanticModel) {
        if (syntax instanceof FunctionCallSyntax call) {
            boolean isAny = call.arguments().size() == 1
                    && semanticModel
                            .getSymbolInfo(call)
                            .filter(FunctionSymbol.class::isInstance)
                            .map(Symbol::name)
                            .filter(LanguageConstants.ANY_FUNCTION::equals)
                            .isPresent();
            return isAny ? call.arguments().get(0) : null;
        }
        if (syntax instanceof InstanceFunctionCallSyntax call) {
            boolean isAny = call.arguments().size() == 1
                    && LanguageConstants.ANY_FUNCTION.equals(call.name())
                    && semanticModel
                            .getSymbolInfo(call.baseExpression())
                            .filter(NamespaceSymbol.class::isInstance)
                            .isPresent();
            return isAny ? call.arguments().get(0) : null;
        }
        return null;
    }

    Optional<ModuleSymbol> lookupModule(SyntaxBase syntax) {
        return semanticModel()
                .getSymbolInfo(syntax)
                .filter(ModuleSymbol.class::isInstance)
                .map(ModuleSymbol.class::cast);
    }

    private static FunctionExpression copyIndex(String name) {
        return name == null
                ? FunctionExpression.of(LanguageConstants.COPY_INDEX_FUNCTION)
                : FunctionExpression.of(LanguageConstants.COPY_INDEX_FUNCTION, TokenExpression.of(name));
    }

    private static FunctionExpression booleanExpression(boolean value) {
        return FunctionExpression.of(value ? "true" : "false");
    }

    private static UnsupportedConstructException loopNotSupported(ForSyntax loop) {
        return new UnsupportedConstructException(
                "Loops are not supported in this position", loop.kind(), loop.span());
    }

    private SemanticModel semanticModel() {
        return context.semanticModel();
    }

    private EmitterSettings settings() {
        return context.settings();
    }
}
