package com.github.nlayna.coldarchive.model;

import lombok.Data;

@Data
public class RestoreSubmission {
    private String key;
    private RestoreTier tier = RestoreTier.STANDARD;
}
