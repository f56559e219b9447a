package com.lyshra.open.cms.core.engine.validation;

import com.lyshra.open.cms.core.exception.request.InvalidRequestException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Bean validation of incoming service requests.
 */
public final class RequestValidator {

    private static volatile ValidatorFactory validatorFactory;

    private RequestValidator() {
        // Utility class
    }

    private static ValidatorFactory getValidatorFactory() {
        if (validatorFactory == null) {
            synchronized (RequestValidator.class) {
                if (validatorFactory == null) {
                    validatorFactory = Validation.byDefaultProvider()
                            .configure()
                            .messageInterpolator(new ParameterMessageInterpolator())
                            .buildValidatorFactory();
                }
            }
        }
        return validatorFactory;
    }

    /**
     * Validates a request.
     *
     * @return the request, or an {@link InvalidRequestException} listing every violation as {@code path: message}
     */
    public static <T> Mono<T> validate(T request) {
        if (request == null) {
            return Mono.error(new InvalidRequestException("Request is required"));
        }
        return Mono.defer(() -> {
            Set<ConstraintViolation<T>> violations = getValidatorFactory().getValidator().validate(request);
            if (violations.isEmpty()) {
                return Mono.just(request);
            }
            List<String> messages = violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                    .toList();
            return Mono.error(new InvalidRequestException(
                    "Invalid " + request.getClass().getSimpleName(), messages));
        });
    }
}
