package com.lyshra.open.flow.core.engine.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Bean-validation front end for workflow and trigger definitions.
 */
public class LyshraOpenFlowDefinitionValidator {

    private final ValidatorFactory validatorFactory;

    private LyshraOpenFlowDefinitionValidator() {
        validatorFactory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
    }

    private static final class SingletonHelper {
        private static final LyshraOpenFlowDefinitionValidator INSTANCE = new LyshraOpenFlowDefinitionValidator();
    }

    public static LyshraOpenFlowDefinitionValidator getInstance() {
        return SingletonHelper.INSTANCE;
    }

    /**
     * Constraint violations of {@code definition} as {@code path: message}, sorted by path.
     */
    public List<String> validate(Object definition) {
        Set<ConstraintViolation<Object>> violations = validatorFactory.getValidator().validate(definition);
        return violations.stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .toList();
    }
}
