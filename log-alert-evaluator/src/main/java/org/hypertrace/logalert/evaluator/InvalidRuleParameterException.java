package org.hypertrace.logalert.evaluator;

/** A rule parameter is missing or can not be used by the condition it configures. */
class InvalidRuleParameterException extends RuntimeException {

  InvalidRuleParameterException(String message) {
    super(message);
  }

  InvalidRuleParameterException(String message, Throwable cause) {
    super(message, cause);
  }
}
