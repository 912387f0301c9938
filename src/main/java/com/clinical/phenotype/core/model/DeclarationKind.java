package com.clinical.phenotype.core.model;

/**
 * Kinds of named declarations in a phenotype library.
 * Term sets, document sets, cohorts and defines are also dependency graph nodes.
 */
public enum DeclarationKind {
    INCLUDE("include"),
    CODESYSTEM("codesystem"),
    TERMSET("termset"),
    DOCUMENTSET("documentset"),
    COHORT("cohort"),
    DEFINE("define");

    private final String keyword;

    DeclarationKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isGraphNode() {
        return this != INCLUDE && this != CODESYSTEM;
    }
}
