package org.yamldiff.reporting;

public final class FormatOptions {

    private static final FormatOptions DEFAULTS = new FormatOptions(false, false);

    private final boolean omitHeader;
    private final boolean goPatchStyle;

    public FormatOptions(boolean omitHeader, boolean goPatchStyle) {
        this.omitHeader = omitHeader;
        this.goPatchStyle = goPatchStyle;
    }

    public static FormatOptions defaults() {
        return DEFAULTS;
    }

    public boolean isOmitHeader() {
        return omitHeader;
    }

    /** Render paths as {@code /a/b/0} instead of {@code a.b.0}. */
    public boolean isGoPatchStyle() {
        return goPatchStyle;
    }
}
