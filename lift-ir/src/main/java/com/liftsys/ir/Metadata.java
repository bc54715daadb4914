package com.liftsys.ir;

import java.util.Objects;

/**
 * IR 来源信息
 */
public final class Metadata {

    public static final Metadata EMPTY = new Metadata(null, null, null);

    private final String sourcePath;
    private final String language;
    private final String origin;

    public Metadata(String sourcePath, String language, String origin) {
        this.sourcePath = sourcePath;
        this.language = language;
        this.origin = origin;
    }

    public String getSourcePath() { return sourcePath; }
    public String getLanguage() { return language; }
    public String getOrigin() { return origin; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Metadata)) return false;
        Metadata other = (Metadata) o;
        return Objects.equals(sourcePath, other.sourcePath)
                && Objects.equals(language, other.language)
                && Objects.equals(origin, other.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourcePath, language, origin);
    }
}
