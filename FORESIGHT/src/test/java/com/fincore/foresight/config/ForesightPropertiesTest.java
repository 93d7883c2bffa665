package com.fincore.foresight.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Constraint checks on {@link ForesightProperties}.
 */
class ForesightPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    @DisplayName("should accept the defaults")
    void defaultsAreValid() {
        assertThat(validator.validate(new ForesightProperties())).isEmpty();
    }

    @Test
    @DisplayName("should reject a zero ridge penalty")
    void zeroRidgeAlphaRejected() {
        ForesightProperties properties = new ForesightProperties();
        properties.getForecast().setRidgeAlpha(0.0);

        Set<ConstraintViolation<ForesightProperties>> violations = validator.validate(properties);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactly("forecast.ridgeAlpha");
    }

    @Test
    @DisplayName("should accept a small positive ridge penalty")
    void smallRidgeAlphaAccepted() {
        ForesightProperties properties = new ForesightProperties();
        properties.getForecast().setRidgeAlpha(1e-6);

        assertThat(validator.validate(properties)).isEmpty();
    }
}
