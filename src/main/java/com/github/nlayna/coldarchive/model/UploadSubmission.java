package com.github.nlayna.coldarchive.model;

import lombok.Data;

import java.util.List;

@Data
public class UploadSubmission {
    private List<String> filePaths;
    private KeyNamingOptions keyOptions;
}
