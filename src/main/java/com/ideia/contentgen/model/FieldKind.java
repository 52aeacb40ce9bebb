package com.ideia.contentgen.model;

/** Disjoint fingerprint sets kept by the hash index. */
public enum FieldKind {
    TITLE,
    CONTENT,
    QUESTION
}
