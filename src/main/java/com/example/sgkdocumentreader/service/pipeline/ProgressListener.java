package com.example.sgkdocumentreader.service.pipeline;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (step, total, message) -> {
    };

    void onProgress(int step, int total, String message);
}
