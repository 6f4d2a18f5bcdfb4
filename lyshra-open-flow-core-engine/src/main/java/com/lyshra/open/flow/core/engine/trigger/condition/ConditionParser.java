package com.lyshra.open.flow.core.engine.trigger.condition;

import com.lyshra.open.flow.integration.contract.trigger.ConditionNode;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowComparisonOperator;
import com.lyshra.open.flow.integration.exception.RuleEvaluationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts between condition documents and {@link ConditionNode} trees.
 *
 * <p>A node is a map with a single operator key whose value is the operand list. A value
 * that is not a list is shorthand for a one-element list. Anything that is not a map is a
 * literal, lists included.</p>
 *
 * <pre>{@code
 * and:
 *   - eq: [{var: type}, workflow_finished]
 *   - eq: [{var: data.state}, failed]
 * }</pre>
 */
public final class ConditionParser {

    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";
    public static final String BOOL = "bool";
    public static final String VAR = "var";

    private ConditionParser() {}

    public static ConditionNode parse(Object document) {
        if (!(document instanceof Map<?, ?> map)) {
            return new ConditionNode.Literal(document);
        }
        if (map.size() != 1) {
            throw new RuleEvaluationException("a condition node must have exactly one operator, found " + map.keySet());
        }
        Map.Entry<?, ?> entry = map.entrySet().iterator().next();
        String operator = String.valueOf(entry.getKey());
        List<?> operands = entry.getValue() instanceof List<?> list ? list : singleton(entry.getValue());

        Optional<LyshraOpenFlowComparisonOperator> comparison = LyshraOpenFlowComparisonOperator.fromTag(operator);
        if (comparison.isPresent()) {
            requireArity(operator, operands, 2);
            return new ConditionNode.Comparison(comparison.get(), parse(operands.get(0)), parse(operands.get(1)));
        }
        switch (operator) {
            case AND:
                return new ConditionNode.And(parseAll(operands));
            case OR:
                return new ConditionNode.Or(parseAll(operands));
            case NOT:
                requireArity(operator, operands, 1);
                return new ConditionNode.Not(parse(operands.get(0)));
            case BOOL:
                requireArity(operator, operands, 1);
                return new ConditionNode.BoolCast(parse(operands.get(0)));
            case VAR:
                return parseVar(operands);
            default:
                throw new RuleEvaluationException("unknown condition operator [" + operator + "]");
        }
    }

    /** Inverse of {@link #parse(Object)}. */
    public static Object toDocument(ConditionNode node) {
        if (node instanceof ConditionNode.Literal literal) {
            return literal.value();
        }
        if (node instanceof ConditionNode.Var var) {
            return var.fallback() == null
                    ? single(VAR, var.path())
                    : single(VAR, List.of(var.path(), var.fallback()));
        }
        if (node instanceof ConditionNode.Comparison comparison) {
            return single(comparison.operator().tag(),
                    listOf(toDocument(comparison.left()), toDocument(comparison.right())));
        }
        if (node instanceof ConditionNode.And and) {
            return single(AND, toDocuments(and.operands()));
        }
        if (node instanceof ConditionNode.Or or) {
            return single(OR, toDocuments(or.operands()));
        }
        if (node instanceof ConditionNode.Not not) {
            return single(NOT, listOf(toDocument(not.operand())));
        }
        if (node instanceof ConditionNode.BoolCast cast) {
            return single(BOOL, listOf(toDocument(cast.operand())));
        }
        throw new IllegalArgumentException("Unsupported condition node " + node);
    }

    private static ConditionNode parseVar(List<?> operands) {
        if (operands.isEmpty() || operands.size() > 2) {
            throw new RuleEvaluationException("var expects a path and an optional fallback, found " + operands.size() + " operands");
        }
        if (!(operands.get(0) instanceof String path) || path.isBlank()) {
            throw new RuleEvaluationException("var path must be a non-blank string, found " + operands.get(0));
        }
        Object fallback = operands.size() == 2 ? operands.get(1) : null;
        if (fallback instanceof Map<?, ?>) {
            throw new RuleEvaluationException("var fallback must be a literal");
        }
        return new ConditionNode.Var(path, fallback);
    }

    private static List<ConditionNode> parseAll(Collection<?> operands) {
        List<ConditionNode> nodes = new ArrayList<>(operands.size());
        for (Object operand : operands) {
            nodes.add(parse(operand));
        }
        return nodes;
    }

    private static List<Object> toDocuments(List<ConditionNode> nodes) {
        List<Object> documents = new ArrayList<>(nodes.size());
        for (ConditionNode node : nodes) {
            documents.add(toDocument(node));
        }
        return documents;
    }

    private static void requireArity(String operator, List<?> operands, int expected) {
        if (operands.size() != expected) {
            throw new RuleEvaluationException(operator + " expects " + expected + " operand(s), found " + operands.size());
        }
    }

    private static List<Object> singleton(Object value) {
        List<Object> list = new ArrayList<>(1);
        list.add(value);
        return list;
    }

    private static List<Object> listOf(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        for (Object value : values) {
            list.add(value);
        }
        return list;
    }

    private static Map<String, Object> single(String operator, Object operands) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(operator, operands);
        return map;
    }
}
