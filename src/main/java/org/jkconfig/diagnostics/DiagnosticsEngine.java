package org.jkconfig.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting the warnings raised while parsing Kconfig files, evaluating
 * symbol values and loading configuration files.
 * <p>
 * Every reported warning is also logged at WARN level, so a command line run shows it on the console.
 * Reporting is a no-op while the engine is disabled.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private boolean enabled;

    /**
     * @param enabled Whether warnings are recorded initially.
     */
    public DiagnosticsEngine(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Reports a warning without a location.
     *
     * @param message The warning message.
     */
    public void reportWarning(String message) {
        reportWarning(message, null, 0);
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param fileName   The file in which the warning occurred, or {@code null}.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber) {
        if (!enabled) {
            return;
        }
        Diagnostic diagnostic = new Diagnostic(message, fileName, lineNumber);
        diagnostics.add(diagnostic);
        LOG.warn("{}", diagnostic.format());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The formatted text of every collected warning, in reporting order.
     */
    public List<String> getWarnings() {
        return diagnostics.stream()
                .map(Diagnostic::format)
                .toList();
    }
}
