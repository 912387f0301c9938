package com.clinical.phenotype.core.model;

import java.util.Set;

/**
 * Body of a define: a task invocation or a logical/threshold expression.
 */
public interface DefineBody {

    /**
     * Names of the declarations this body consumes.
     */
    Set<String> references();
}
