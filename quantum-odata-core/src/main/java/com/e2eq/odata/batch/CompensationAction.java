package com.e2eq.odata.batch;

/**
 * Undo step that would reverse a successful changeset operation.
 */
public enum CompensationAction {
    /** Undo a POST. */
    DELETE_CREATED,
    /** Undo a DELETE. */
    RESTORE_DELETED,
    /** Undo a PUT or PATCH. */
    REVERT_UPDATE;

    public static CompensationAction forMethod(String method) {
        switch (method) {
            case "POST":
                return DELETE_CREATED;
            case "DELETE":
                return RESTORE_DELETED;
            case "PUT":
            case "PATCH":
                return REVERT_UPDATE;
            default:
                return null;
        }
    }
}
