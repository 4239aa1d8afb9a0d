package com.linlay.chatrunner.tool.document;

import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryDocumentRepository implements DocumentRepository {

    private final Map<String, Document> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<Document> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(id.trim()));
    }

    @Override
    public Document save(Document document) {
        documents.put(document.id(), document);
        return document;
    }
}
