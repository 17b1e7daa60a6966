package com.github.nlayna.coldarchive.model;

import com.github.nlayna.coldarchive.exception.JobOperationException;

import java.util.List;

public record SubmissionResult(List<UploadJob> accepted, List<Rejection> rejected) {

    public record Rejection(String filePath, JobOperationException.Reason reason, String message) {
    }
}
