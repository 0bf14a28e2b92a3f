package com.tio.parameters;

/** Precedence tier a resolved value came from, highest first. */
public enum ResolutionTier {
    RUNTIME_OVERRIDE,
    USER,
    ORGANIZATION,
    SYSTEM_DEFAULT
}
