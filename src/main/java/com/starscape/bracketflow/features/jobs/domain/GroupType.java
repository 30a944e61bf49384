package com.starscape.bracketflow.features.jobs.domain;

import java.util.Locale;

public enum GroupType {
    /** Exposure bracket merged into one image. */
    HDR,
    /** Single raw frame. */
    RAW,
    /** Single rendered frame or pass-through file. */
    IMAGE,
    /** Grouping supplied by the compute provider. */
    GROUP;
    
    public static GroupType singletonFor(FileKind kind) {
        return kind == FileKind.RAW ? RAW : IMAGE;
    }
    
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
