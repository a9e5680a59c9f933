package com.classlayout.core.layout;

/**
 * Box style for a laid-out classifier.
 */
public enum ClassifierKind {
    CLASS,
    INTERFACE,
    ABSTRACT_CLASS,
    ENUM,
    ANNOTATION,
    ENTITY
}
