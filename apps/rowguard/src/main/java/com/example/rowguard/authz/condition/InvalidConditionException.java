package com.example.rowguard.authz.condition;

/**
 * Raised when a condition string does not match the condition grammar.
 */
public class InvalidConditionException extends IllegalArgumentException {

    private final String condition;

    public InvalidConditionException(String condition) {
        super("Invalid condition: " + condition);
        this.condition = condition;
    }

    public String getCondition() {
        return condition;
    }
}
