package com.lyshra.open.flow.integration.contract.trigger;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowComparisonOperator;

import java.util.List;
import java.util.Objects;

/**
 * Expression tree of a condition rule. Evaluated by structural recursion over the variants.
 */
public sealed interface ConditionNode {

    record Comparison(LyshraOpenFlowComparisonOperator operator, ConditionNode left, ConditionNode right)
            implements ConditionNode {
        public Comparison {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record And(List<ConditionNode> operands) implements ConditionNode {
        public And {
            operands = List.copyOf(operands);
        }
    }

    record Or(List<ConditionNode> operands) implements ConditionNode {
        public Or {
            operands = List.copyOf(operands);
        }
    }

    record Not(ConditionNode operand) implements ConditionNode {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record BoolCast(ConditionNode operand) implements ConditionNode {
        public BoolCast {
            Objects.requireNonNull(operand, "operand");
        }
    }

    /**
     * Dot-delimited path resolved against the event, for example {@code data.state}.
     * {@code fallback} replaces a missing value when it is not {@code null}.
     */
    record Var(String path, Object fallback) implements ConditionNode {
        public Var {
            Objects.requireNonNull(path, "path");
        }

        public Var(String path) {
            this(path, null);
        }
    }

    /** Constant operand; {@code value} may be {@code null}. */
    record Literal(Object value) implements ConditionNode {
    }

    static ConditionNode var(String path) {
        return new Var(path);
    }

    static ConditionNode literal(Object value) {
        return new Literal(value);
    }

    static ConditionNode eq(ConditionNode left, ConditionNode right) {
        return new Comparison(LyshraOpenFlowComparisonOperator.EQ, left, right);
    }

    static ConditionNode and(ConditionNode... operands) {
        return new And(List.of(operands));
    }

    static ConditionNode or(ConditionNode... operands) {
        return new Or(List.of(operands));
    }

    static ConditionNode not(ConditionNode operand) {
        return new Not(operand);
    }
}
