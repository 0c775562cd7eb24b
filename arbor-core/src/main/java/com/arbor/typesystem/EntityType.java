package com.arbor.typesystem;

public enum EntityType {
    NAMESPACE,
    TYPE,
    METHOD,
    CONSTRUCTOR,
    FIELD,
    PROPERTY,
    LOCAL,
    PARAMETER,
    BUILTIN_FUNCTION,
    AMBIGUOUS,
    ERROR
}
