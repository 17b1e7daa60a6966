package com.github.nlayna.coldarchive.config;

import com.github.nlayna.coldarchive.model.UploadConfigRequest;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Startup upload settings under {@code upload.*}: a tier plus optional overrides of its defaults.
 */
@Component
@ConfigurationProperties(prefix = "upload")
public class UploadProperties extends UploadConfigRequest {
}
