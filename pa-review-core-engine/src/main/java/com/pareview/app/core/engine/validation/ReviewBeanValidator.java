package com.pareview.app.core.engine.validation;

import com.pareview.app.core.exception.ReviewConstraintViolation;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Runs Jakarta Bean Validation over request models and flattens the result.
 */
public class ReviewBeanValidator {

    private final Validator validator;

    private ReviewBeanValidator() {
        ValidatorFactory factory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        this.validator = factory.getValidator();
    }

    /**
     * Validates the object graph. Violations come back ordered by property path.
     */
    public List<ReviewConstraintViolation> validate(Object target) {
        if (target == null) {
            return List.of(new ReviewConstraintViolation("<root>", "must not be null"));
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(target);
        return violations.stream()
                .map(violation -> new ReviewConstraintViolation(
                        violation.getPropertyPath().toString(), violation.getMessage()))
                .sorted(Comparator.comparing(ReviewConstraintViolation::field)
                        .thenComparing(ReviewConstraintViolation::message))
                .toList();
    }

    private static final class SingletonHolder {
        private static final ReviewBeanValidator INSTANCE = new ReviewBeanValidator();
    }

    public static ReviewBeanValidator getInstance() {
        return SingletonHolder.INSTANCE;
    }
}
