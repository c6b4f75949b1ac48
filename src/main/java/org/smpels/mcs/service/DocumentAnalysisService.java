package org.smpels.mcs.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smpels.mcs.api.AnalysisResult;
import org.smpels.mcs.api.IMcsAnalyzer;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the latest analysis per open document for editor-style consumers.
 * <p>
 * Each update carries a monotonically increasing version. Analyses of different documents run in parallel;
 * for one document the result of an older version never replaces the result of a newer one, and an update
 * that is already outdated when it starts is skipped. Closing a document discards its updates still in flight.
 */
public class DocumentAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(DocumentAnalysisService.class);

    private final IMcsAnalyzer analyzer;
    private final Executor executor;
    private final Map<String, DocumentSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, VersionedResult> published = new ConcurrentHashMap<>();

    /**
     * A published analysis together with the document version it was computed from.
     *
     * @param version The document version.
     * @param result  The analysis of that version.
     */
    public record VersionedResult(long version, AnalysisResult result) {}

    /**
     * One open period of a document, from its first update to {@link #close(String)}.
     * An update only publishes while the session it was requested in is still current.
     */
    private static final class DocumentSession {
        private final AtomicLong requested = new AtomicLong(Long.MIN_VALUE);
    }

    /**
     * @param analyzer The analyzer; it must be safe to call from several threads.
     * @param executor Runs the asynchronous updates.
     */
    public DocumentAnalysisService(IMcsAnalyzer analyzer, Executor executor) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Analyzes a new version of a document on the calling thread.
     * @param uri     The document identifier.
     * @param version The document version.
     * @param text    The full text of that version.
     * @return The result, or empty if a newer version was requested or published in the meantime,
     *         or the document was closed.
     */
    public Optional<AnalysisResult> update(String uri, long version, String text) {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(text, "text");
        return analyze(uri, request(uri, version), version, text);
    }

    /**
     * Analyzes a new version of a document on the service's executor.
     * @param uri     The document identifier.
     * @param version The document version.
     * @param text    The full text of that version.
     * @return A future completing with the result, or with empty if the version was superseded
     *         or the document was closed.
     */
    public CompletableFuture<Optional<AnalysisResult>> updateAsync(String uri, long version, String text) {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(text, "text");
        DocumentSession session = request(uri, version);
        return CompletableFuture.supplyAsync(() -> analyze(uri, session, version, text), executor);
    }

    /**
     * @param uri The document identifier.
     * @return The newest published analysis of the document, or empty.
     */
    public Optional<VersionedResult> latest(String uri) {
        return Optional.ofNullable(published.get(uri));
    }

    /**
     * Forgets a document. Updates still running for it are discarded when they finish.
     * @param uri The document identifier.
     */
    public void close(String uri) {
        sessions.remove(uri);
        published.remove(uri);
    }

    /**
     * @return The identifiers of the documents with a published analysis.
     */
    public Set<String> openDocuments() {
        return Set.copyOf(published.keySet());
    }

    private DocumentSession request(String uri, long version) {
        DocumentSession session = sessions.computeIfAbsent(uri, key -> new DocumentSession());
        session.requested.accumulateAndGet(version, Math::max);
        return session;
    }

    private Optional<AnalysisResult> analyze(String uri, DocumentSession session, long version, String text) {
        if (isOutdated(uri, session, version)) {
            log.debug("Skipping analysis of {} v{}: a newer version is pending or the document was closed", uri, version);
            return Optional.empty();
        }
        AnalysisResult result = analyzer.analyze(text);
        VersionedResult candidate = new VersionedResult(version, result);
        // Only a session that is still current may publish.
        VersionedResult winner = published.compute(uri, (key, current) -> {
            if (sessions.get(key) != session) {
                return current;
            }
            return current == null || candidate.version() > current.version() ? candidate : current;
        });
        if (winner != candidate) {
            log.debug("Discarding analysis of {} v{}: superseded or closed", uri, version);
            return Optional.empty();
        }
        log.debug("Published analysis of {} v{} with {} findings", uri, version, result.diagnostics().size());
        return Optional.of(result);
    }

    private boolean isOutdated(String uri, DocumentSession session, long version) {
        if (sessions.get(uri) != session || session.requested.get() > version) {
            return true;
        }
        VersionedResult current = published.get(uri);
        return current != null && current.version() >= version;
    }
}
