package com.xammer.spectre.service;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total, description) -> { };

    void onProgress(int completed, int total, String description);
}
