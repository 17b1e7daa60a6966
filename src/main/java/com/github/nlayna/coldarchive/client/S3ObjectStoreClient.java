package com.github.nlayna.coldarchive.client;

import com.github.nlayna.coldarchive.config.ArchiveProperties;
import com.github.nlayna.coldarchive.exception.ObjectNotFoundException;
import com.github.nlayna.coldarchive.exception.PermanentTransferException;
import com.github.nlayna.coldarchive.exception.TransferException;
import com.github.nlayna.coldarchive.exception.TransientTransferException;
import com.github.nlayna.coldarchive.model.ArchivedObject;
import com.github.nlayna.coldarchive.model.RestoreTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.GlacierJobParameters;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListPartsRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.RestoreObjectRequest;
import software.amazon.awssdk.services.s3.model.RestoreRequest;
import software.amazon.awssdk.services.s3.model.Tier;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class S3ObjectStoreClient implements ObjectStoreClient {

    private static final String CONTENT_TYPE = "application/octet-stream";
    private static final Set<String> ARCHIVE_STORAGE_CLASSES = Set.of("GLACIER", "DEEP_ARCHIVE");
    private static final Set<String> TRANSIENT_ERROR_CODES = Set.of(
            "RequestTimeout", "RequestTimeTooSkewed", "SlowDown", "Throttling", "ThrottlingException",
            "InternalError", "ServiceUnavailable");
    private static final Pattern ONGOING_REQUEST = Pattern.compile("ongoing-request=\"(true|false)\"");
    private static final Pattern EXPIRY_DATE = Pattern.compile("expiry-date=\"([^\"]+)\"");

    private final S3Client s3Client;
    private final ArchiveProperties archiveProperties;

    public S3ObjectStoreClient(S3Client s3Client, ArchiveProperties archiveProperties) {
        this.s3Client = s3Client;
        this.archiveProperties = archiveProperties;
    }

    @Override
    public void putObject(String key, PartSource source, Duration timeout) throws TransferException {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket())
                .key(key)
                .storageClass(archiveProperties.getStorageClass())
                .contentLength(source.length())
                .overrideConfiguration(timeoutOverride(timeout))
                .build();
        try {
            s3Client.putObject(request, requestBody(source));
            log.debug("Put object {} ({} bytes)", key, source.length());
        } catch (SdkException | UncheckedIOException e) {
            throw translate("put object", key, e);
        }
    }

    @Override
    public String initiateMultipartUpload(String key, Duration timeout) throws TransferException {
        CreateMultipartUploadRequest request = CreateMultipartUploadRequest.builder()
                .bucket(bucket())
                .key(key)
                .storageClass(archiveProperties.getStorageClass())
                .contentType(CONTENT_TYPE)
                .overrideConfiguration(timeoutOverride(timeout))
                .build();
        try {
            String uploadId = s3Client.createMultipartUpload(request).uploadId();
            log.debug("Initiated multipart upload {} for {}", uploadId, key);
            return uploadId;
        } catch (SdkException e) {
            throw translate("initiate multipart upload", key, e);
        }
    }

    @Override
    public String uploadPart(String key, String uploadId, int partNumber, PartSource source, Duration timeout)
            throws TransferException {
        UploadPartRequest request = UploadPartRequest.builder()
                .bucket(bucket())
                .key(key)
                .uploadId(uploadId)
                .partNumber(partNumber)
                .contentLength(source.length())
                .overrideConfiguration(timeoutOverride(timeout))
                .build();
        try {
            return s3Client.uploadPart(request, requestBody(source)).eTag();
        } catch (SdkException | UncheckedIOException e) {
            throw translate("upload part " + partNumber, key, e);
        }
    }

    @Override
    public void completeMultipartUpload(String key, String uploadId, List<CompletedPartRef> parts, Duration timeout)
            throws TransferException {
        List<CompletedPart> completedParts = parts.stream()
                .map(part -> CompletedPart.builder().partNumber(part.partNumber()).eTag(part.eTag()).build())
                .toList();
        CompleteMultipartUploadRequest request = CompleteMultipartUploadRequest.builder()
                .bucket(bucket())
                .key(key)
                .uploadId(uploadId)
                .multipartUpload(CompletedMultipartUpload.builder().parts(completedParts).build())
                .overrideConfiguration(timeoutOverride(timeout))
                .build();
        try {
            s3Client.completeMultipartUpload(request);
            log.debug("Completed multipart upload {} for {} ({} parts)", uploadId, key, parts.size());
        } catch (SdkException e) {
            throw translate("complete multipart upload", key, e);
        }
    }

    @Override
    public void abortMultipartUpload(String key, String uploadId, Duration timeout) throws TransferException {
        AbortMultipartUploadRequest request = AbortMultipartUploadRequest.builder()
                .bucket(bucket())
                .key(key)
                .uploadId(uploadId)
                .overrideConfiguration(timeoutOverride(timeout))
                .build();
        try {
            s3Client.abortMultipartUpload(request);
            log.debug("Aborted multipart upload {} for {}", uploadId, key);
        } catch (SdkException e) {
            throw translate("abort multipart upload", key, e);
        }
    }

    @Override
    public List<CompletedPartRef> listUploadedParts(String key, String uploadId, Duration timeout)
            throws TransferException {
        ListPartsRequest request = ListPartsRequest.builder()
                .bucket(bucket())
                .key(key)
                .uploadId(uploadId)
                .overrideConfiguration(timeoutOverride(timeout))
                .build();
        try {
            List<CompletedPartRef> parts = new ArrayList<>();
            s3Client.listPartsPaginator(request).parts().forEach(part ->
                    parts.add(new CompletedPartRef(part.partNumber(), part.eTag(),
                            part.size() == null ? 0 : part.size())));
            return parts;
        } catch (SdkException e) {
            throw translate("list parts", key, e);
        }
    }

    @Override
    public List<ArchivedObject> listObjects(String prefix) throws TransferException {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket())
                .prefix(prefix)
                .overrideConfiguration(timeoutOverride(archiveProperties.getRequestTimeout()))
                .build();
        try {
            List<ArchivedObject> objects = new ArrayList<>();
            s3Client.listObjectsV2Paginator(request).contents().forEach(object ->
                    objects.add(new ArchivedObject(object.key(), object.size() == null ? 0 : object.size(),
                            object.lastModified(), object.storageClassAsString(), object.eTag())));
            return objects;
        } catch (SdkException e) {
            throw translate("list objects", prefix, e);
        }
    }

    @Override
    public void requestRestore(String key, RestoreTier tier, int days) throws TransferException {
        RestoreObjectRequest request = RestoreObjectRequest.builder()
                .bucket(bucket())
                .key(key)
                .restoreRequest(RestoreRequest.builder()
                        .days(days)
                        .glacierJobParameters(GlacierJobParameters.builder()
                                .tier(Tier.fromValue(toSdkTier(tier)))
                                .build())
                        .build())
                .overrideConfiguration(timeoutOverride(archiveProperties.getRequestTimeout()))
                .build();
        try {
            s3Client.restoreObject(request);
            log.info("Requested {} restore of {} for {} days", tier, key, days);
        } catch (AwsServiceException e) {
            if ("RestoreAlreadyInProgress".equals(errorCode(e))) {
                log.info("Restore of {} is already in progress", key);
                return;
            }
            throw translate("restore object", key, e);
        } catch (SdkException e) {
            throw translate("restore object", key, e);
        }
    }

    @Override
    public ArchiveRestoreState getRestoreState(String key) throws TransferException {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucket())
                .key(key)
                .overrideConfiguration(timeoutOverride(archiveProperties.getRequestTimeout()))
                .build();
        HeadObjectResponse head;
        try {
            head = s3Client.headObject(request);
        } catch (SdkException e) {
            TransferException translated = translate("head object", key, e);
            if (translated instanceof ObjectNotFoundException) {
                return ArchiveRestoreState.of(ArchiveRestoreState.Phase.NOT_FOUND);
            }
            throw translated;
        }
        return parseRestoreState(head.storageClassAsString(), head.restore());
    }

    @Override
    public ObjectContent openObject(String key) throws TransferException {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket())
                .key(key)
                .overrideConfiguration(timeoutOverride(archiveProperties.getDownload().getTimeout()))
                .build();
        try {
            ResponseInputStream<GetObjectResponse> stream = s3Client.getObject(request);
            GetObjectResponse response = stream.response();
            long contentLength = response.contentLength() == null ? -1 : response.contentLength();
            return new ObjectContent(stream, contentLength, response.eTag());
        } catch (SdkException e) {
            throw translate("get object", key, e);
        }
    }

    /**
     * Reads the {@code x-amz-restore} header, e.g.
     * {@code ongoing-request="false", expiry-date="Fri, 23 Dec 2012 00:00:00 GMT"}.
     */
    static ArchiveRestoreState parseRestoreState(String storageClass, String restoreHeader) {
        if (storageClass == null || !ARCHIVE_STORAGE_CLASSES.contains(storageClass)) {
            return ArchiveRestoreState.of(ArchiveRestoreState.Phase.NOT_ARCHIVED);
        }
        if (restoreHeader == null || restoreHeader.isBlank()) {
            return ArchiveRestoreState.of(ArchiveRestoreState.Phase.NOT_RESTORED);
        }
        Matcher ongoing = ONGOING_REQUEST.matcher(restoreHeader);
        if (ongoing.find() && Boolean.parseBoolean(ongoing.group(1))) {
            return ArchiveRestoreState.of(ArchiveRestoreState.Phase.IN_PROGRESS);
        }

        Instant expiresAt = null;
        Matcher expiry = EXPIRY_DATE.matcher(restoreHeader);
        if (expiry.find()) {
            try {
                expiresAt = ZonedDateTime.parse(expiry.group(1), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            } catch (DateTimeParseException e) {
                log.warn("Unparseable restore expiry date '{}': {}", expiry.group(1), e.getMessage());
            }
        }
        if (expiresAt != null && expiresAt.isBefore(Instant.now())) {
            return ArchiveRestoreState.of(ArchiveRestoreState.Phase.NOT_RESTORED);
        }
        return new ArchiveRestoreState(ArchiveRestoreState.Phase.RESTORED, expiresAt);
    }

    /**
     * Maps an SDK failure onto the transient/permanent taxonomy, keeping the store's message.
     */
    static TransferException translate(String operation, String key, Exception e) {
        String message = e.getMessage();
        log.debug("Failed to {} {}: {}", operation, key, message);

        if (e instanceof UncheckedIOException) {
            return new TransientTransferException(message, e);
        }
        if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
            return new TransientTransferException(message, e);
        }
        if (e instanceof AwsServiceException) {
            AwsServiceException serviceException = (AwsServiceException) e;
            int statusCode = serviceException.statusCode();
            if (statusCode == 404) {
                return new ObjectNotFoundException(message, e);
            }
            if (serviceException.isThrottlingException() || statusCode >= 500 || statusCode == 408
                    || statusCode == 429 || TRANSIENT_ERROR_CODES.contains(errorCode(serviceException))) {
                return new TransientTransferException(message, e);
            }
            return new PermanentTransferException(message, e);
        }
        if (e instanceof SdkClientException) {
            SdkClientException clientException = (SdkClientException) e;
            if (clientException.retryable() || hasIoCause(clientException)) {
                return new TransientTransferException(message, e);
            }
            return new PermanentTransferException(message, e);
        }
        return new PermanentTransferException(message, e);
    }

    private static boolean hasIoCause(Throwable e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException) {
                return true;
            }
        }
        return false;
    }

    private static String errorCode(AwsServiceException e) {
        return e.awsErrorDetails() == null ? null : e.awsErrorDetails().errorCode();
    }

    private static String toSdkTier(RestoreTier tier) {
        return switch (tier) {
            case EXPEDITED -> "Expedited";
            case STANDARD -> "Standard";
            case BULK -> "Bulk";
        };
    }

    private static RequestBody requestBody(PartSource source) {
        return RequestBody.fromContentProvider(() -> {
            try {
                return source.openStream();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + source.file(), e);
            }
        }, source.length(), CONTENT_TYPE);
    }

    private static AwsRequestOverrideConfiguration timeoutOverride(Duration timeout) {
        return AwsRequestOverrideConfiguration.builder().apiCallTimeout(timeout).build();
    }

    private String bucket() {
        return archiveProperties.getBucket();
    }
}
