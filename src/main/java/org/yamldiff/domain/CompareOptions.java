package org.yamldiff.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable settings consumed by every comparison call.
 */
public final class CompareOptions {

    private static final CompareOptions DEFAULTS = builder().build();

    private final boolean ignoreOrderChanges;
    private final boolean ignoreWhitespaceChanges;
    private final boolean ignoreValueChanges;
    private final boolean detectKubernetes;
    private final boolean detectRenames;
    private final boolean ignoreApiVersion;
    private final List<String> additionalIdentifiers;
    private final boolean swap;
    private final String chroot;
    private final String chrootFrom;
    private final String chrootTo;
    private final boolean chrootListToDocuments;

    private CompareOptions(Builder builder) {
        this.ignoreOrderChanges = builder.ignoreOrderChanges;
        this.ignoreWhitespaceChanges = builder.ignoreWhitespaceChanges;
        this.ignoreValueChanges = builder.ignoreValueChanges;
        this.detectKubernetes = builder.detectKubernetes;
        this.detectRenames = builder.detectRenames;
        this.ignoreApiVersion = builder.ignoreApiVersion;
        this.additionalIdentifiers = Collections.unmodifiableList(new ArrayList<>(builder.additionalIdentifiers));
        this.swap = builder.swap;
        this.chroot = emptyToNull(builder.chroot);
        this.chrootFrom = emptyToNull(builder.chrootFrom);
        this.chrootTo = emptyToNull(builder.chrootTo);
        this.chrootListToDocuments = builder.chrootListToDocuments;
    }

    /** Every flag off, no additional identifiers, no chroot. */
    public static CompareOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .ignoreOrderChanges(ignoreOrderChanges)
                .ignoreWhitespaceChanges(ignoreWhitespaceChanges)
                .ignoreValueChanges(ignoreValueChanges)
                .detectKubernetes(detectKubernetes)
                .detectRenames(detectRenames)
                .ignoreApiVersion(ignoreApiVersion)
                .additionalIdentifiers(additionalIdentifiers)
                .swap(swap)
                .chroot(chroot)
                .chrootFrom(chrootFrom)
                .chrootTo(chrootTo)
                .chrootListToDocuments(chrootListToDocuments);
    }

    public boolean isIgnoreOrderChanges() { return ignoreOrderChanges; }
    public boolean isIgnoreWhitespaceChanges() { return ignoreWhitespaceChanges; }
    public boolean isIgnoreValueChanges() { return ignoreValueChanges; }
    public boolean isDetectKubernetes() { return detectKubernetes; }
    public boolean isDetectRenames() { return detectRenames; }
    public boolean isIgnoreApiVersion() { return ignoreApiVersion; }
    public List<String> getAdditionalIdentifiers() { return additionalIdentifiers; }
    public boolean isSwap() { return swap; }
    public String getChroot() { return chroot; }
    public String getChrootFrom() { return chrootFrom; }
    public String getChrootTo() { return chrootTo; }
    public boolean isChrootListToDocuments() { return chrootListToDocuments; }

    @Override
    public String toString() {
        return "CompareOptions{" +
                "ignoreOrderChanges=" + ignoreOrderChanges +
                ", ignoreWhitespaceChanges=" + ignoreWhitespaceChanges +
                ", ignoreValueChanges=" + ignoreValueChanges +
                ", detectKubernetes=" + detectKubernetes +
                ", detectRenames=" + detectRenames +
                ", ignoreApiVersion=" + ignoreApiVersion +
                ", additionalIdentifiers=" + additionalIdentifiers +
                ", swap=" + swap +
                ", chroot='" + chroot + '\'' +
                ", chrootFrom='" + chrootFrom + '\'' +
                ", chrootTo='" + chrootTo + '\'' +
                ", chrootListToDocuments=" + chrootListToDocuments +
                '}';
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    public static final class Builder {
        private boolean ignoreOrderChanges;
        private boolean ignoreWhitespaceChanges;
        private boolean ignoreValueChanges;
        private boolean detectKubernetes;
        private boolean detectRenames;
        private boolean ignoreApiVersion;
        private List<String> additionalIdentifiers = new ArrayList<>();
        private boolean swap;
        private String chroot;
        private String chrootFrom;
        private String chrootTo;
        private boolean chrootListToDocuments;

        private Builder() {
        }

        public Builder ignoreOrderChanges(boolean value) { this.ignoreOrderChanges = value; return this; }
        public Builder ignoreWhitespaceChanges(boolean value) { this.ignoreWhitespaceChanges = value; return this; }
        public Builder ignoreValueChanges(boolean value) { this.ignoreValueChanges = value; return this; }
        public Builder detectKubernetes(boolean value) { this.detectKubernetes = value; return this; }
        public Builder detectRenames(boolean value) { this.detectRenames = value; return this; }
        public Builder ignoreApiVersion(boolean value) { this.ignoreApiVersion = value; return this; }
        public Builder swap(boolean value) { this.swap = value; return this; }
        public Builder chroot(String path) { this.chroot = path; return this; }
        public Builder chrootFrom(String path) { this.chrootFrom = path; return this; }
        public Builder chrootTo(String path) { this.chrootTo = path; return this; }
        public Builder chrootListToDocuments(boolean value) { this.chrootListToDocuments = value; return this; }

        public Builder additionalIdentifiers(List<String> identifiers) {
            this.additionalIdentifiers = identifiers == null ? new ArrayList<>() : new ArrayList<>(identifiers);
            return this;
        }

        public Builder additionalIdentifier(String identifier) {
            this.additionalIdentifiers.add(identifier);
            return this;
        }

        public CompareOptions build() {
            return new CompareOptions(this);
        }
    }
}
