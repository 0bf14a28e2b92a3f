package com.tio.pluginconfig;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Analyzer-only attributes: whether it analyzes observables or files, and what it supports.
 * Empty supported sets mean "everything of that type".
 */
public final class AnalyzerAttributes {

    public enum AnalyzerType {
        OBSERVABLE,
        FILE
    }

    private final AnalyzerType type;
    private final Set<ObservableClassification> observableSupported;
    private final Set<String> supportedFiletypes;
    private final Set<String> notSupportedFiletypes;

    public AnalyzerAttributes(AnalyzerType type, Set<ObservableClassification> observableSupported,
                              Set<String> supportedFiletypes, Set<String> notSupportedFiletypes) {
        this.type = type != null ? type : AnalyzerType.OBSERVABLE;
        this.observableSupported = copy(observableSupported);
        this.supportedFiletypes = copy(supportedFiletypes);
        this.notSupportedFiletypes = copy(notSupportedFiletypes);
    }

    /** Observable analyzer supporting every classification. */
    public static AnalyzerAttributes anyObservable() {
        return new AnalyzerAttributes(AnalyzerType.OBSERVABLE, Set.of(), Set.of(), Set.of());
    }

    private static <T> Set<T> copy(Set<T> in) {
        return in != null ? Collections.unmodifiableSet(new LinkedHashSet<>(in)) : Set.of();
    }

    public AnalyzerType getType() {
        return type;
    }

    public Set<ObservableClassification> getObservableSupported() {
        return observableSupported;
    }

    public Set<String> getSupportedFiletypes() {
        return supportedFiletypes;
    }

    public Set<String> getNotSupportedFiletypes() {
        return notSupportedFiletypes;
    }

    /** Whether an observable analyzer accepts the classification. File analyzers never do. */
    public boolean supportsObservable(ObservableClassification classification) {
        if (type != AnalyzerType.OBSERVABLE) return false;
        return observableSupported.isEmpty() || observableSupported.contains(classification);
    }

    /** Whether a file analyzer accepts the mime type. Observable analyzers never do. */
    public boolean supportsFile(String mimeType) {
        if (type != AnalyzerType.FILE) return false;
        if (mimeType != null && notSupportedFiletypes.contains(mimeType)) return false;
        return supportedFiletypes.isEmpty() || (mimeType != null && supportedFiletypes.contains(mimeType));
    }
}
