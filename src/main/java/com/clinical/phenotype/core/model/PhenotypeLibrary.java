package com.clinical.phenotype.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Root of a bound phenotype script. Immutable once built.
 * Declaration maps preserve parse order.
 */
public class PhenotypeLibrary {
    private final String name;
    private final String version;
    private final String description;
    private final String dataModel;
    private final String dataModelVersion;
    private final ContextType context;
    private final boolean debug;
    private final Integer documentLimit;
    private final List<Include> includes;
    private final Map<String, CodeSystem> codeSystems;
    private final Map<String, TermSet> termSets;
    private final Map<String, DocumentSet> documentSets;
    private final Map<String, Cohort> cohorts;
    private final Map<String, Define> defines;

    private PhenotypeLibrary(Builder builder) {
        this.name = builder.name;
        this.version = builder.version;
        this.description = builder.description;
        this.dataModel = builder.dataModel;
        this.dataModelVersion = builder.dataModelVersion;
        this.context = builder.context;
        this.debug = builder.debug;
        this.documentLimit = builder.documentLimit;
        this.includes = Collections.unmodifiableList(new ArrayList<>(builder.includes));
        this.codeSystems = Collections.unmodifiableMap(new LinkedHashMap<>(builder.codeSystems));
        this.termSets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.termSets));
        this.documentSets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.documentSets));
        this.cohorts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cohorts));
        this.defines = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defines));
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Optional<String> getDataModel() {
        return Optional.ofNullable(dataModel);
    }

    public Optional<String> getDataModelVersion() {
        return Optional.ofNullable(dataModelVersion);
    }

    public ContextType getContext() {
        return context;
    }

    public boolean isDebug() {
        return debug;
    }

    public OptionalInt getDocumentLimit() {
        return documentLimit == null ? OptionalInt.empty() : OptionalInt.of(documentLimit);
    }

    public List<Include> getIncludes() {
        return includes;
    }

    public Map<String, CodeSystem> getCodeSystems() {
        return codeSystems;
    }

    public Map<String, TermSet> getTermSets() {
        return termSets;
    }

    public Map<String, DocumentSet> getDocumentSets() {
        return documentSets;
    }

    public Map<String, Cohort> getCohorts() {
        return cohorts;
    }

    public Map<String, Define> getDefines() {
        return defines;
    }

    public Define getDefine(String defineName) {
        return defines.get(defineName);
    }

    /**
     * Final defines in declaration order.
     */
    public List<Define> getFinalDefines() {
        return defines.values().stream().filter(Define::isFinal).toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String version;
        private String description;
        private String dataModel;
        private String dataModelVersion;
        private ContextType context = ContextType.PATIENT;
        private boolean debug;
        private Integer documentLimit;
        private final List<Include> includes = new ArrayList<>();
        private final Map<String, CodeSystem> codeSystems = new LinkedHashMap<>();
        private final Map<String, TermSet> termSets = new LinkedHashMap<>();
        private final Map<String, DocumentSet> documentSets = new LinkedHashMap<>();
        private final Map<String, Cohort> cohorts = new LinkedHashMap<>();
        private final Map<String, Define> defines = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder dataModel(String dataModel, String dataModelVersion) {
            this.dataModel = dataModel;
            this.dataModelVersion = dataModelVersion;
            return this;
        }

        public Builder context(ContextType context) {
            this.context = context;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder documentLimit(Integer documentLimit) {
            if (documentLimit != null && documentLimit <= 0) {
                throw new IllegalArgumentException("documentLimit must be positive");
            }
            this.documentLimit = documentLimit;
            return this;
        }

        public Builder include(Include include) {
            includes.add(include);
            return this;
        }

        public Builder codeSystem(CodeSystem codeSystem) {
            codeSystems.put(codeSystem.name(), codeSystem);
            return this;
        }

        public Builder termSet(TermSet termSet) {
            termSets.put(termSet.name(), termSet);
            return this;
        }

        public Builder documentSet(DocumentSet documentSet) {
            documentSets.put(documentSet.name(), documentSet);
            return this;
        }

        public Builder cohort(Cohort cohort) {
            cohorts.put(cohort.name(), cohort);
            return this;
        }

        public Builder define(Define define) {
            defines.put(define.name(), define);
            return this;
        }

        public PhenotypeLibrary build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("phenotype name is required");
            }
            return new PhenotypeLibrary(this);
        }
    }
}
