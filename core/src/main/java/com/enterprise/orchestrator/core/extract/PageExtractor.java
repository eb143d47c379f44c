package com.enterprise.orchestrator.core.extract;

import java.util.List;

/**
 * Splits a source document into per-page text, page 1 first.
 */
public interface PageExtractor {

    /**
     * @throws com.enterprise.orchestrator.core.exception.DocumentIngestException if the document
     *                                                                           cannot be parsed
     */
    List<String> extractPages(byte[] document);
}
