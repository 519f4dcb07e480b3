package io.templateemit.core.expression;

/**
 * Node of the deployment engine's embedded expression language. Either a function call (with
 * optional trailing property/index accessors) or a literal token. Instances are immutable.
 */
public sealed interface TargetExpression permits FunctionExpression, TokenExpression {}
