package com.example.sgkdocumentreader.model;

public enum DateRole {
    BIRTH,
    DOCUMENT,
    UNKNOWN
}
