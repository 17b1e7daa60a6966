package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.exception.PermanentTransferException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Resolves the active credential set before a transfer touches the object store.
 */
@Component
@RequiredArgsConstructor
public class CredentialVerifier {

    private final AwsCredentialsProvider credentialsProvider;

    public void verify() throws PermanentTransferException {
        try {
            credentialsProvider.resolveCredentials();
        } catch (SdkException e) {
            throw new PermanentTransferException(e.getMessage(), e);
        }
    }
}
