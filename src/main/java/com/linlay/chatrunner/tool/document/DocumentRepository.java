package com.linlay.chatrunner.tool.document;

import java.util.Optional;

/**
 * Storage of generated documents. The in-memory implementation stands in for real persistence.
 */
public interface DocumentRepository {

    Optional<Document> findById(String id);

    Document save(Document document);
}
