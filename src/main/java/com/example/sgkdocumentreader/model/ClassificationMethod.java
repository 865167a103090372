package com.example.sgkdocumentreader.model;

public enum ClassificationMethod {
    KEYWORD_RULE,
    DELEGATED,
    DEFAULT
}
