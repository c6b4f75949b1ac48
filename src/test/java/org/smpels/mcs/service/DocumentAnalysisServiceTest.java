package org.smpels.mcs.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.smpels.mcs.api.AnalysisResult;
import org.smpels.mcs.api.IMcsAnalyzer;
import org.smpels.mcs.frontend.parser.ast.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link DocumentAnalysisService}, which keeps the newest analysis per document.
 */
@ExtendWith(MockitoExtension.class)
public class DocumentAnalysisServiceTest {

    @Mock
    private IMcsAnalyzer analyzer;

    private ExecutorService executor;
    private DocumentAnalysisService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        service = new DocumentAnalysisService(analyzer, executor);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static AnalysisResult emptyResult(String text) {
        return new AnalysisResult(new Document(List.of(text), List.of(), List.of()), List.of());
    }

    @Test
    @Tag("unit")
    void publishesNewerVersion() {
        // Arrange
        AnalysisResult v1 = emptyResult("one");
        AnalysisResult v2 = emptyResult("two");
        when(analyzer.analyze("one")).thenReturn(v1);
        when(analyzer.analyze("two")).thenReturn(v2);

        // Act
        Optional<AnalysisResult> first = service.update("file:///a.mcs", 1, "one");
        Optional<AnalysisResult> second = service.update("file:///a.mcs", 2, "two");

        // Assert
        assertThat(first).containsSame(v1);
        assertThat(second).containsSame(v2);
        assertThat(service.latest("file:///a.mcs")).get()
                .extracting(DocumentAnalysisService.VersionedResult::version).isEqualTo(2L);
    }

    /**
     * Verifies that a stale version is neither analyzed nor published once a newer one is known.
     */
    @Test
    @Tag("unit")
    void skipsOutdatedVersion() {
        when(analyzer.analyze("new")).thenReturn(emptyResult("new"));
        service.update("file:///a.mcs", 5, "new");

        Optional<AnalysisResult> stale = service.update("file:///a.mcs", 4, "old");

        assertThat(stale).isEmpty();
        verify(analyzer, never()).analyze("old");
        assertThat(service.latest("file:///a.mcs")).get()
                .extracting(DocumentAnalysisService.VersionedResult::version).isEqualTo(5L);
    }

    @Test
    @Tag("unit")
    void concurrentUpdatesEndWithHighestVersion() {
        // Arrange
        when(analyzer.analyze(anyString())).thenAnswer(invocation -> emptyResult(invocation.getArgument(0)));
        List<CompletableFuture<Optional<AnalysisResult>>> futures = new ArrayList<>();

        // Act
        for (int version = 1; version <= 50; version++) {
            futures.add(service.updateAsync("file:///b.mcs", version, "v" + version));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // Assert
        assertThat(service.latest("file:///b.mcs")).get()
                .extracting(DocumentAnalysisService.VersionedResult::version).isEqualTo(50L);
        assertThat(futures.get(49).join()).isPresent();
    }

    @Test
    @Tag("unit")
    void closeForgetsDocument() {
        when(analyzer.analyze("x")).thenReturn(emptyResult("x"));
        service.update("file:///c.mcs", 1, "x");

        service.close("file:///c.mcs");

        assertThat(service.latest("file:///c.mcs")).isEmpty();
        assertThat(service.openDocuments()).isEmpty();
    }

    /**
     * Verifies that an analysis finishing after its document was closed does not bring the document back.
     */
    @Test
    @Tag("unit")
    void analysisFinishingAfterCloseIsDiscarded() {
        // Arrange
        when(analyzer.analyze("late")).thenAnswer(invocation -> {
            service.close("file:///d.mcs");
            return emptyResult("late");
        });

        // Act
        Optional<AnalysisResult> result = service.update("file:///d.mcs", 1, "late");

        // Assert
        assertThat(result).isEmpty();
        assertThat(service.latest("file:///d.mcs")).isEmpty();
        assertThat(service.openDocuments()).isEmpty();
    }

    @Test
    @Tag("unit")
    void reopenedDocumentStartsOverAtAnyVersion() {
        // Arrange
        when(analyzer.analyze(anyString())).thenAnswer(invocation -> emptyResult(invocation.getArgument(0)));
        service.update("file:///e.mcs", 7, "before");
        service.close("file:///e.mcs");

        // Act
        Optional<AnalysisResult> reopened = service.update("file:///e.mcs", 1, "after");

        // Assert
        assertThat(reopened).isPresent();
        assertThat(service.latest("file:///e.mcs")).get()
                .extracting(DocumentAnalysisService.VersionedResult::version).isEqualTo(1L);
    }
}
