package com.crudbase.model;

import com.google.common.base.Strings;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Email;
import javax.annotation.Nullable;
import org.hibernate.validator.HibernateValidator;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

/** Email syntax checks through Bean Validation's {@link Email} constraint. */
final class EmailAddresses {

  private static final Validator VALIDATOR =
      Validation.byProvider(HibernateValidator.class)
          .configure()
          .messageInterpolator(new ParameterMessageInterpolator())
          .buildValidatorFactory()
          .getValidator();

  private EmailAddresses() {
    // Utility class, no instances
  }

  /** Returns whether {@code email} is a well-formed address whose domain has at least one dot. */
  static boolean isValid(@Nullable String email) {
    if (Strings.isNullOrEmpty(email)) {
      return false;
    }
    return VALIDATOR.validateValue(Address.class, "value", email).isEmpty();
  }

  private static final class Address {
    @Email(regexp = "[^@]+@[^@]+\\.[^@]+")
    private String value;
  }
}
