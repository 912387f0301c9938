package com.clinical.phenotype.core.model;

/**
 * External library providing a task catalog, referenced in the script through its alias.
 */
public record Include(String libraryName, String version, String alias, SourcePosition position) {
}
