package com.clinical.phenotype.script.ast;

import com.clinical.phenotype.core.model.SourcePosition;

import java.util.List;

/**
 * Top-level script statements.
 */
public interface Statement {

    SourcePosition position();

    record Phenotype(String name, String version, SourcePosition position) implements Statement {
    }

    record Version(String version, SourcePosition position) implements Statement {
    }

    record Description(String text, SourcePosition position) implements Statement {
    }

    record DataModel(String name, String version, SourcePosition position) implements Statement {
    }

    record Include(String library, String version, String alias, SourcePosition position) implements Statement {
    }

    record CodeSystem(String name, String uri, SourcePosition position) implements Statement {
    }

    /**
     * Either {@code terms} is set (literal list) or {@code call} is (coded expansion).
     */
    record TermSet(String name, List<String> terms, Call call, SourcePosition position) implements Statement {
    }

    record DocumentSet(String name, Call call, SourcePosition position) implements Statement {
    }

    record Cohort(String name, Call call, SourcePosition position) implements Statement {
    }

    record Context(String context, SourcePosition position) implements Statement {
    }

    /**
     * Either {@code call} is set (task invocation) or {@code expression} is.
     */
    record Define(String name, boolean isFinal, Call call, ExpressionNode expression,
                  SourcePosition position) implements Statement {
    }

    record Debug(SourcePosition position) implements Statement {
    }

    record Limit(int limit, SourcePosition position) implements Statement {
    }
}
