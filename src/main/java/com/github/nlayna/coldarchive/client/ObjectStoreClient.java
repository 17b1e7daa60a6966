package com.github.nlayna.coldarchive.client;

import com.github.nlayna.coldarchive.exception.TransferException;
import com.github.nlayna.coldarchive.model.ArchivedObject;
import com.github.nlayna.coldarchive.model.RestoreTier;

import java.time.Duration;
import java.util.List;

/**
 * Operations the archive needs from the cloud object store. Implementations report
 * failures as {@link com.github.nlayna.coldarchive.exception.TransientTransferException}
 * or {@link com.github.nlayna.coldarchive.exception.PermanentTransferException}.
 */
public interface ObjectStoreClient {

    void putObject(String key, PartSource source, Duration timeout) throws TransferException;

    String initiateMultipartUpload(String key, Duration timeout) throws TransferException;

    /**
     * @return the ETag of the stored part
     */
    String uploadPart(String key, String uploadId, int partNumber, PartSource source, Duration timeout)
            throws TransferException;

    void completeMultipartUpload(String key, String uploadId, List<CompletedPartRef> parts, Duration timeout)
            throws TransferException;

    void abortMultipartUpload(String key, String uploadId, Duration timeout) throws TransferException;

    /**
     * Parts already stored for an unfinished multipart upload.
     *
     * @throws com.github.nlayna.coldarchive.exception.ObjectNotFoundException if the upload no longer exists
     */
    List<CompletedPartRef> listUploadedParts(String key, String uploadId, Duration timeout) throws TransferException;

    List<ArchivedObject> listObjects(String prefix) throws TransferException;

    /**
     * Asks for a temporary readable copy of an archived object. A request for a key that is
     * already being restored succeeds.
     */
    void requestRestore(String key, RestoreTier tier, int days) throws TransferException;

    ArchiveRestoreState getRestoreState(String key) throws TransferException;

    ObjectContent openObject(String key) throws TransferException;
}
