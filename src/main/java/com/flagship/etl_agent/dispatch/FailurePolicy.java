package com.flagship.etl_agent.dispatch;

/**
 * What an adapter does when a handler throws.
 */
public enum FailurePolicy {
    /** Convert the failure into an ERROR {@link TaskResult}; the transport sees a normal completion. */
    REPORT,
    /** Propagate a {@link HandlerFailureException} so the transport's own retry handling engages. */
    RETHROW
}
