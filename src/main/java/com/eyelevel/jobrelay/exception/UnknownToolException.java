package com.eyelevel.jobrelay.exception;

import java.io.Serial;

public class UnknownToolException extends JobRelayException {
    @Serial
    private static final long serialVersionUID = 5580337912046813390L;

    public UnknownToolException(String toolId) {
        super("Unknown tool: " + toolId);
    }
}
