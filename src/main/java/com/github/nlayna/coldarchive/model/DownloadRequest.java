package com.github.nlayna.coldarchive.model;

import lombok.Data;

@Data
public class DownloadRequest {
    private String key;
    private String localPath;
}
