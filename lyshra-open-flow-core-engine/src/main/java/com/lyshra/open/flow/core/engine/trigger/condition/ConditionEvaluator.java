package com.lyshra.open.flow.core.engine.trigger.condition;

import com.lyshra.open.flow.core.util.CastUtil;
import com.lyshra.open.flow.integration.contract.event.IEvent;
import com.lyshra.open.flow.integration.contract.trigger.ConditionNode;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowComparisonOperator;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowMissingPathPolicy;
import com.lyshra.open.flow.integration.exception.RuleEvaluationException;
import com.lyshra.open.flow.integration.models.events.Event;
import lombok.Getter;

import java.util.Objects;

/**
 * Recursive interpreter for condition trees. Paths are resolved against the document form of
 * the event ({@code type}, {@code data.state}, ...).
 */
public class ConditionEvaluator {

    @Getter
    private final LyshraOpenFlowMissingPathPolicy missingPathPolicy;
    private final EventPathResolver pathResolver;

    public ConditionEvaluator(LyshraOpenFlowMissingPathPolicy missingPathPolicy) {
        this(missingPathPolicy, new EventPathResolver());
    }

    public ConditionEvaluator(LyshraOpenFlowMissingPathPolicy missingPathPolicy, EventPathResolver pathResolver) {
        this.missingPathPolicy = Objects.requireNonNull(missingPathPolicy, "missingPathPolicy");
        this.pathResolver = pathResolver;
    }

    public boolean test(ConditionNode condition, IEvent event) {
        return CastUtil.isTruthy(evaluate(condition, Event.toMap(event)));
    }

    public Object evaluate(ConditionNode node, Object document) {
        if (node instanceof ConditionNode.Literal literal) {
            return literal.value();
        }
        if (node instanceof ConditionNode.Var var) {
            return resolve(var, document);
        }
        if (node instanceof ConditionNode.Comparison comparison) {
            Object left = evaluate(comparison.left(), document);
            Object right = evaluate(comparison.right(), document);
            return compare(comparison.operator(), left, right);
        }
        if (node instanceof ConditionNode.And and) {
            for (ConditionNode operand : and.operands()) {
                if (!CastUtil.isTruthy(evaluate(operand, document))) {
                    return false;
                }
            }
            return true;
        }
        if (node instanceof ConditionNode.Or or) {
            for (ConditionNode operand : or.operands()) {
                if (CastUtil.isTruthy(evaluate(operand, document))) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof ConditionNode.Not not) {
            return !CastUtil.isTruthy(evaluate(not.operand(), document));
        }
        if (node instanceof ConditionNode.BoolCast cast) {
            return CastUtil.isTruthy(evaluate(cast.operand(), document));
        }
        throw new RuleEvaluationException("unsupported condition node " + node);
    }

    private Object resolve(ConditionNode.Var var, Object document) {
        EventPathResolver.Resolution resolution = pathResolver.resolve(document, var.path());
        if (resolution.found()) {
            return resolution.value();
        }
        if (var.fallback() != null) {
            return var.fallback();
        }
        if (missingPathPolicy == LyshraOpenFlowMissingPathPolicy.ERROR) {
            throw new RuleEvaluationException("path [" + var.path() + "] is not present in the event");
        }
        return null;
    }

    private static boolean compare(LyshraOpenFlowComparisonOperator operator, Object left, Object right) {
        switch (operator) {
            case EQ:
                return isEqual(left, right);
            case NE:
                return !isEqual(left, right);
            default:
                if (left == null || right == null) {
                    return false;
                }
                int order = order(left, right);
                switch (operator) {
                    case GT:
                        return order > 0;
                    case LT:
                        return order < 0;
                    case GE:
                        return order >= 0;
                    case LE:
                        return order <= 0;
                    default:
                        throw new RuleEvaluationException("unsupported comparison " + operator);
                }
        }
    }

    private static boolean isEqual(Object left, Object right) {
        if (CastUtil.isNumeric(left) && CastUtil.isNumeric(right)) {
            return CastUtil.castAsBigDecimal(left).compareTo(CastUtil.castAsBigDecimal(right)) == 0;
        }
        return Objects.equals(left, right);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int order(Object left, Object right) {
        if (CastUtil.isNumeric(left) && CastUtil.isNumeric(right)) {
            return CastUtil.castAsBigDecimal(left).compareTo(CastUtil.castAsBigDecimal(right));
        }
        if (left instanceof Comparable comparable && left.getClass().equals(right.getClass())) {
            return comparable.compareTo(right);
        }
        throw new RuleEvaluationException("cannot order " + left.getClass().getSimpleName()
                + " against " + right.getClass().getSimpleName());
    }
}
