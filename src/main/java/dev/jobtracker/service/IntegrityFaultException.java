package dev.jobtracker.service;

import dev.jobtracker.model.IntegrityFault;
import lombok.Getter;

/**
 * A store operation would break, or found broken, the one-posting-per-identity invariant.
 */
@Getter
public class IntegrityFaultException extends RuntimeException {

    private final transient IntegrityFault fault;

    public IntegrityFaultException(IntegrityFault fault) {
        super(fault.describe());
        this.fault = fault;
    }

    public IntegrityFaultException(String message) {
        super(message);
        this.fault = null;
    }
}
