package com.clinical.phenotype.script.ast;

import com.clinical.phenotype.core.model.SourcePosition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unbound call argument.
 */
public interface ParamNode {

    SourcePosition position();

    /**
     * String, Double or Boolean literal.
     */
    record Literal(Object value, SourcePosition position) implements ParamNode {
    }

    record Identifier(String name, SourcePosition position) implements ParamNode {
    }

    record ListNode(List<ParamNode> items, SourcePosition position) implements ParamNode {
        public ListNode {
            items = List.copyOf(items);
        }
    }

    record ObjectNode(Map<String, ParamNode> entries, SourcePosition position) implements ParamNode {
        public ObjectNode {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }
}
