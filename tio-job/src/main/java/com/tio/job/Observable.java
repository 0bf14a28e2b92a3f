package com.tio.job;

import com.tio.pluginconfig.ObservableClassification;

import java.util.Objects;

/** What a job analyzes: a classified observable value, or a file with its mime type. */
public final class Observable {

    private final String name;
    private final ObservableClassification classification;
    private final String mimeType;

    private Observable(String name, ObservableClassification classification, String mimeType) {
        this.name = Objects.requireNonNull(name, "name");
        this.classification = classification;
        this.mimeType = mimeType;
    }

    public static Observable of(String name, ObservableClassification classification) {
        return new Observable(name, Objects.requireNonNull(classification, "classification"), null);
    }

    public static Observable file(String fileName, String mimeType) {
        return new Observable(fileName, null, mimeType);
    }

    /** Observable value or file name. */
    public String getName() {
        return name;
    }

    /** Null for files. */
    public ObservableClassification getClassification() {
        return classification;
    }

    /** Null for observables. */
    public String getMimeType() {
        return mimeType;
    }

    public boolean isFile() {
        return classification == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Observable that = (Observable) o;
        return name.equals(that.name) && classification == that.classification
                && Objects.equals(mimeType, that.mimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, classification, mimeType);
    }

    @Override
    public String toString() {
        return isFile() ? "file:" + name + " (" + mimeType + ")" : classification + ":" + name;
    }
}
