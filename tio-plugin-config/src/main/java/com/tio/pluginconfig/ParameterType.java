package com.tio.pluginconfig;

import java.util.List;
import java.util.Map;

/** Declared type of a plugin parameter. Codes match the manifest format ("str", "int", ...). */
public enum ParameterType {

    STRING("str"),
    INT("int"),
    FLOAT("float"),
    BOOL("bool"),
    LIST("list"),
    DICT("dict");

    private final String code;

    ParameterType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether a value (as produced by JSON deserialization) matches this type.
     * Null never matches; an INT is accepted for FLOAT.
     */
    public boolean accepts(Object value) {
        if (value == null) return false;
        switch (this) {
            case STRING:
                return value instanceof String;
            case INT:
                return value instanceof Integer || value instanceof Long || value instanceof Short
                        || value instanceof java.math.BigInteger;
            case FLOAT:
                return value instanceof Number;
            case BOOL:
                return value instanceof Boolean;
            case LIST:
                return value instanceof List;
            case DICT:
                return value instanceof Map;
            default:
                return false;
        }
    }

    /**
     * @param code manifest code ("str", "int", "float", "bool", "list", "dict") or enum name
     * @throws IllegalArgumentException if unknown
     */
    public static ParameterType fromCode(String code) {
        if (code == null) throw new IllegalArgumentException("Parameter type must be non-null");
        String c = code.trim();
        for (ParameterType t : values()) {
            if (t.code.equalsIgnoreCase(c) || t.name().equalsIgnoreCase(c)) return t;
        }
        throw new IllegalArgumentException("Unknown parameter type: " + code);
    }
}
