package com.flagship.etl_agent.dispatch;

import lombok.Getter;

/**
 * Raised when a caller that needs delivery for correctness gets a {@link DispatchError}.
 */
@Getter
public class DispatchException extends RuntimeException {

    private final DispatchError error;

    public DispatchException(DispatchError error) {
        super(error.describe());
        this.error = error;
    }
}
