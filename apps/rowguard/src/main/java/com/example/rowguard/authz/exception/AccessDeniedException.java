package com.example.rowguard.authz.exception;

import lombok.Getter;
import org.springframework.lang.Nullable;

// Raised when a guarded operation is refused. The message never carries the parse error of a policy.
@Getter
public class AccessDeniedException extends RuntimeException {

    @Nullable
    private final String principal;
    private final String resource;

    public AccessDeniedException(String message, @Nullable String principal, String resource) {
        super(message);
        this.principal = principal;
        this.resource = resource;
    }
}
