package com.eyelevel.jobrelay.exception;

import java.io.Serial;

/**
 * Thrown when a rule change cannot be applied, or the tool keeps no rules at all.
 */
public class InvalidRuleException extends JobRelayException {
    @Serial
    private static final long serialVersionUID = 6120945372807716245L;

    public InvalidRuleException(String message) {
        super(message);
    }
}
