package com.e2eq.odata.metadata;

import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.Map;

/**
 * Maps field type keywords to EDM primitive types.
 */
public final class EdmTypeMapper {
    private static final Logger LOG = Logger.getLogger(EdmTypeMapper.class);

    public static final String EDM_STRING = "Edm.String";
    public static final String EDM_DOUBLE = "Edm.Double";
    public static final String EDM_INT32 = "Edm.Int32";
    public static final String EDM_BOOLEAN = "Edm.Boolean";
    public static final String EDM_DATE = "Edm.Date";
    public static final String EDM_DATE_TIME_OFFSET = "Edm.DateTimeOffset";
    public static final String EDM_TIME_OF_DAY = "Edm.TimeOfDay";

    private static final Map<String, String> TYPES = Map.ofEntries(
            Map.entry("text", EDM_STRING),
            Map.entry("textarea", EDM_STRING),
            Map.entry("markdown", EDM_STRING),
            Map.entry("html", EDM_STRING),
            Map.entry("email", EDM_STRING),
            Map.entry("url", EDM_STRING),
            Map.entry("phone", EDM_STRING),
            Map.entry("password", EDM_STRING),
            Map.entry("select", EDM_STRING),
            Map.entry("lookup", EDM_STRING),
            Map.entry("master_detail", EDM_STRING),
            Map.entry("file", EDM_STRING),
            Map.entry("image", EDM_STRING),
            Map.entry("object", EDM_STRING),
            Map.entry("formula", EDM_STRING),
            Map.entry("summary", EDM_STRING),
            Map.entry("number", EDM_DOUBLE),
            Map.entry("currency", EDM_DOUBLE),
            Map.entry("percent", EDM_DOUBLE),
            Map.entry("autonumber", EDM_INT32),
            Map.entry("boolean", EDM_BOOLEAN),
            Map.entry("date", EDM_DATE),
            Map.entry("datetime", EDM_DATE_TIME_OFFSET),
            Map.entry("time", EDM_TIME_OF_DAY));

    private EdmTypeMapper() {
    }

    public static String toEdmType(String fieldType) {
        if (fieldType == null) {
            LOG.warn("Field without a type; mapping to Edm.String");
            return EDM_STRING;
        }
        String edm = TYPES.get(fieldType.toLowerCase(Locale.ROOT));
        if (edm == null) {
            LOG.warnf("Unknown field type '%s'; mapping to Edm.String", fieldType);
            return EDM_STRING;
        }
        return edm;
    }
}
