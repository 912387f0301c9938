package com.clinical.phenotype.core.model;

/**
 * Subject granularity at which results are keyed and compared.
 */
public enum ContextType {
    PATIENT("Patient"),
    DOCUMENT("Document");

    private final String keyword;

    ContextType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Returns the context for a script keyword, or {@code null} when the keyword is unknown.
     */
    public static ContextType fromKeyword(String keyword) {
        for (ContextType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        return null;
    }
}
