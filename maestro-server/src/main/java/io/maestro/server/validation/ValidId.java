package io.maestro.server.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Validates that a string is a safe agent or request identifier.
///
/// A valid identifier:
/// - Is not null or blank
/// - Starts with an alphanumeric character
/// - Contains only alphanumeric characters, dots, hyphens, and underscores
/// - Is at most 128 characters long
///
/// ### Usage
/// ```java
/// @GET
/// @Path("/agents/{id}")
/// public Response agent(@PathParam("id") @ValidId String agentId) { ... }
/// ```
///
/// @see ValidIdValidator
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidIdValidator.class)
@Documented
public @interface ValidId {

    String message() default
            "must be a valid identifier (alphanumeric, dots, hyphens, underscores; 1-128 chars)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
