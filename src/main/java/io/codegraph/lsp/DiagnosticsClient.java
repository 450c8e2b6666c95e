package io.codegraph.lsp;

import org.eclipse.lsp4j.MessageActionItem;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.ShowMessageRequestParams;
import org.eclipse.lsp4j.services.LanguageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

/**
 * Language client that forwards published diagnostics to a listener and logs server messages.
 * <p>
 * Every publication replaces the file's diagnostics, so an empty list clears them.
 */
public class DiagnosticsClient implements LanguageClient {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsClient.class);

    private final Lsp4jConverters converters;
    private final BiConsumer<String, List<Diagnostic>> listener;

    /**
     * @param converters Maps document URIs to workspace paths
     * @param listener   Receives the path and the file's current diagnostics
     */
    public DiagnosticsClient(Lsp4jConverters converters, BiConsumer<String, List<Diagnostic>> listener) {
        this.converters = converters;
        this.listener = listener;
    }

    @Override
    public void publishDiagnostics(PublishDiagnosticsParams params) {
        String path = converters.toPath(params.getUri());
        List<Diagnostic> diagnostics = params.getDiagnostics() == null
                ? List.of()
                : params.getDiagnostics().stream().map(Lsp4jConverters::toDiagnostic).toList();
        log.debug("Received {} diagnostics for {}", diagnostics.size(), path);
        listener.accept(path, diagnostics);
    }

    @Override
    public void telemetryEvent(Object object) {}

    @Override
    public void showMessage(MessageParams params) {
        log.info("Language server: {}", params.getMessage());
    }

    @Override
    public CompletableFuture<MessageActionItem> showMessageRequest(ShowMessageRequestParams params) {
        log.info("Language server request ignored: {}", params.getMessage());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void logMessage(MessageParams params) {
        log.debug("Language server log [{}]: {}", params.getType(), params.getMessage());
    }
}
