package com.flagship.etl_agent.dispatch;

/**
 * Why a payload could not be handed to its transport.
 *
 * @param backend     the backend that was asked to send
 * @param destination queue, task or topic name
 * @param kind        failure category
 * @param reason      human-readable detail, safe to log and return to clients
 */
public record DispatchError(DispatchBackend backend, String destination, Kind kind, String reason) {

    public enum Kind {
        /** Backend switched off or missing its connection configuration. */
        DISABLED,
        /** Transport could not be reached or refused the write. */
        UNREACHABLE,
        /** Envelope could not be encoded. */
        SERIALIZATION,
        /** Transport is up but did not accept the job (shut down, saturated). */
        REJECTED
    }

    public static DispatchError disabled(DispatchBackend backend, String destination, String reason) {
        return new DispatchError(backend, destination, Kind.DISABLED, reason);
    }

    public static DispatchError unreachable(DispatchBackend backend, String destination, Throwable cause) {
        return new DispatchError(backend, destination, Kind.UNREACHABLE, describe(cause));
    }

    public static DispatchError serialization(DispatchBackend backend, String destination, Throwable cause) {
        return new DispatchError(backend, destination, Kind.SERIALIZATION, describe(cause));
    }

    public static DispatchError rejected(DispatchBackend backend, String destination, Throwable cause) {
        return new DispatchError(backend, destination, Kind.REJECTED, describe(cause));
    }

    public String describe() {
        return backend.getKey() + " dispatch to '" + destination + "' failed (" + kind + "): " + reason;
    }

    private static String describe(Throwable cause) {
        Throwable root = cause;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
