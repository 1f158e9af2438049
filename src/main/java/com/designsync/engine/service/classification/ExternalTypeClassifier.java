package com.designsync.engine.service.classification;

import com.designsync.engine.dto.classification.ClassificationRequest;
import com.designsync.engine.dto.classification.ClassificationResult;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Optional remote classifier consulted for nodes the local rules are unsure about.
 *
 * Implementations never complete exceptionally for transport or parsing problems: those
 * complete with an empty result.
 */
public interface ExternalTypeClassifier {

    boolean isAvailable();

    CompletableFuture<Optional<ClassificationResult>> classifyAsync(ClassificationRequest request);
}
