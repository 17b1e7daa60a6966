package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.model.ProgressUpdate;

@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressUpdate update);
}
