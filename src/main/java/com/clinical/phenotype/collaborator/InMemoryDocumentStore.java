package com.clinical.phenotype.collaborator;

import com.clinical.phenotype.core.model.DocumentCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * In-memory document store for tests, demos and the command line runner.
 * Criteria match case-insensitively: {@code report_types} against the report type,
 * {@code report_tags}, {@code provider_roles} and {@code source} against the
 * {@code report_tag}, {@code provider_role} and {@code source} metadata, and
 * {@code filter_query} as a substring of the text.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final List<Document> documents = new CopyOnWriteArrayList<>();
    private final Map<String, Document> byId = new ConcurrentHashMap<>();

    public InMemoryDocumentStore() {
    }

    public InMemoryDocumentStore(List<Document> documents) {
        documents.forEach(this::add);
    }

    public InMemoryDocumentStore add(Document document) {
        if (byId.putIfAbsent(document.documentId(), document) != null) {
            throw new IllegalArgumentException("Duplicate document id: " + document.documentId());
        }
        documents.add(document);
        return this;
    }

    public InMemoryDocumentStore add(String documentId, String subjectId, String reportType, String text) {
        return add(new Document(new DocumentHandle(documentId, subjectId), reportType, text, Map.of()));
    }

    public int size() {
        return documents.size();
    }

    @Override
    public Stream<DocumentHandle> resolveDocumentSet(DocumentCriteria criteria) {
        List<DocumentHandle> matches = new ArrayList<>();
        for (Document document : documents) {
            if (matches(document, criteria)) {
                matches.add(document.handle());
            }
        }
        log.debug("Document set {} resolved to {} documents", criteria.filters(), matches.size());
        return matches.stream();
    }

    @Override
    public Document fetchDocumentText(DocumentHandle handle) {
        Document document = byId.get(handle.documentId());
        if (document == null) {
            throw new IllegalArgumentException("Unknown document: " + handle.documentId());
        }
        return document;
    }

    private boolean matches(Document document, DocumentCriteria criteria) {
        return matchesAny(criteria.get(DocumentCriteria.REPORT_TYPES), document.reportType())
                && matchesAny(criteria.get(DocumentCriteria.REPORT_TAGS), document.metadata().get("report_tag"))
                && matchesAny(criteria.get(DocumentCriteria.PROVIDER_ROLES), document.metadata().get("provider_role"))
                && matchesAny(criteria.get(DocumentCriteria.SOURCE), document.metadata().get("source"))
                && containsAll(criteria.get(DocumentCriteria.FILTER_QUERY), document.text());
    }

    private static boolean matchesAny(List<String> accepted, String actual) {
        if (accepted.isEmpty()) {
            return true;
        }
        return actual != null && accepted.stream().anyMatch(a -> a.equalsIgnoreCase(actual));
    }

    private static boolean containsAll(List<String> queries, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return queries.stream().allMatch(q -> lower.contains(q.toLowerCase(Locale.ROOT)));
    }
}
