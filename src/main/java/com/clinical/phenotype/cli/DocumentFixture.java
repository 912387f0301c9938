package com.clinical.phenotype.cli;

import com.clinical.phenotype.collaborator.Document;
import com.clinical.phenotype.collaborator.DocumentHandle;
import com.clinical.phenotype.collaborator.InMemoryCohortResolver;
import com.clinical.phenotype.collaborator.InMemoryDocumentStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * JSON fixture feeding the in-memory collaborators of {@code phenotype run}:
 * <pre>
 * {
 *   "documents": [
 *     {"id": "d1", "subject": "p1", "reportType": "Radiology Report", "text": "...", "metadata": {}}
 *   ],
 *   "cohorts": {"6": ["p1", "p2"]}
 * }
 * </pre>
 */
record DocumentFixture(List<DocumentEntry> documents, Map<String, List<String>> cohorts) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    DocumentFixture {
        documents = documents != null ? documents : List.of();
        cohorts = cohorts != null ? cohorts : Map.of();
    }

    record DocumentEntry(String id, String subject, String reportType, String text, Map<String, String> metadata) {
    }

    static DocumentFixture load(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), DocumentFixture.class);
    }

    InMemoryDocumentStore documentStore() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        for (DocumentEntry entry : documents) {
            if (entry.id() == null || entry.subject() == null) {
                throw new IllegalArgumentException("Fixture documents need an id and a subject");
            }
            store.add(new Document(new DocumentHandle(entry.id(), entry.subject()),
                    entry.reportType(), entry.text(), entry.metadata()));
        }
        return store;
    }

    InMemoryCohortResolver cohortResolver() {
        InMemoryCohortResolver resolver = new InMemoryCohortResolver();
        cohorts.forEach((key, members) -> resolver.register(key, new HashSet<>(members)));
        return resolver;
    }
}
