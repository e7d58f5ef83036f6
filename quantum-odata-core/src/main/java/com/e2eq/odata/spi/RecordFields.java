package com.e2eq.odata.spi;

/**
 * Field names shared by the protocol layer and data engines.
 */
public final class RecordFields {
    public static final String ID = "_id";
    public static final String UPDATED_AT = "updated_at";
    public static final String CREATED_AT = "created_at";

    private RecordFields() {
    }
}
