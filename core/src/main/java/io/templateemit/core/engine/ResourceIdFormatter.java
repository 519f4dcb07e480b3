package io.templateemit.core.engine;

import io.templateemit.core.expression.FunctionExpression;
import io.templateemit.core.expression.TargetExpression;
import io.templateemit.core.expression.TokenExpression;
import io.templateemit.core.semantics.ResourceScopeData;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds resource id expressions for each deployment scope.
 *
 * <ul>
 *   <li>resource group: {@code resourceId([subscriptionId,] [resourceGroup,] type, names...)}
 *   <li>subscription: {@code subscriptionResourceId([subscriptionId,] type, names...)}
 *   <li>tenant: {@code tenantResourceId(type, names...)}
 *   <li>management group: {@code extensionResourceId(managementGroupId, type, names...)}
 * </ul>
 *
 * Unqualified ids omit the explicit scope arguments.
 */
final class ResourceIdFormatter {

    private ResourceIdFormatter() {}

    static FunctionExpression fullyQualified(
            ExpressionConverter converter, ResourceScopeData scopeData, String type, List<TargetExpression> names) {
        List<TargetExpression> arguments = new ArrayList<>();
        switch (scopeData.scope()) {
            case RESOURCE_GROUP:
                if (scopeData.subscriptionIdExpression() != null) {
                    arguments.add(converter.convertExpression(scopeData.subscriptionIdExpression()));
                }
                if (scopeData.resourceGroupExpression() != null) {
                    arguments.add(converter.convertExpression(scopeData.resourceGroupExpression()));
                }
                return build("resourceId", arguments, type, names);
            case SUBSCRIPTION:
                if (scopeData.subscriptionIdExpression() != null) {
                    arguments.add(converter.convertExpression(scopeData.subscriptionIdExpression()));
                }
                return build("subscriptionResourceId", arguments, type, names);
            case TENANT:
                return build("tenantResourceId", arguments, type, names);
            case MANAGEMENT_GROUP:
                arguments.add(
                        scopeData.managementGroupExpression() != null
                                ? converter.generateManagementGroupResourceId(
                                        scopeData.managementGroupExpression(), true)
                                : currentManagementGroupId());
                return build("extensionResourceId", arguments, type, names);
            default:
                throw new IllegalStateException("Unknown scope: " + scopeData.scope());
        }
    }

    static FunctionExpression unqualified(ResourceScopeData scopeData, String type, List<TargetExpression> names) {
        switch (scopeData.scope()) {
            case RESOURCE_GROUP:
                return build("resourceId", List.of(), type, names);
            case SUBSCRIPTION:
                return build("subscriptionResourceId", List.of(), type, names);
            case TENANT:
                return build("tenantResourceId", List.of(), type, names);
            case MANAGEMENT_GROUP:
                return build("extensionResourceId", List.of(currentManagementGroupId()), type, names);
            default:
                throw new IllegalStateException("Unknown scope: " + scopeData.scope());
        }
    }

    private static FunctionExpression currentManagementGroupId() {
        return FunctionExpression.of("managementGroup").appendProperties(TokenExpression.of("id"));
    }

    private static FunctionExpression build(
            String function, List<TargetExpression> scopeArguments, String type, List<TargetExpression> names) {
        List<TargetExpression> parameters = new ArrayList<>(scopeArguments.size() + names.size() + 1);
        parameters.addAll(scopeArguments);
        parameters.add(TokenExpression.of(type));
        parameters.addAll(names);
        return FunctionExpression.of(function, parameters);
    }
}
