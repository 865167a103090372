package com.example.sgkdocumentreader.model;

public enum MatchMethod {
    FUZZY,
    KEYWORD_SEARCH
}
