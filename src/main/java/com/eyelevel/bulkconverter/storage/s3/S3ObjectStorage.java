package com.eyelevel.bulkconverter.storage.s3;

import com.eyelevel.bulkconverter.exception.ObjectNotFoundException;
import com.eyelevel.bulkconverter.exception.StorageException;
import com.eyelevel.bulkconverter.exception.TransientStorageException;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import com.eyelevel.bulkconverter.model.StoredObject;
import com.eyelevel.bulkconverter.storage.ObjectStorage;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link ObjectStorage} binding for S3-compatible stores. The location's endpoint selects the client, the
 * root is the bucket and folders are key prefixes under the location's path prefix.
 * <p>
 * One {@link S3Client} is built per endpoint and cached; all of them share the pooled HTTP client and the
 * retry/timeout configuration from {@code AwsConfig}. Requests are signed with the configured credentials
 * provider; the location's access token is not forwarded by this binding.
 */
@Slf4j
@Service
public class S3ObjectStorage implements ObjectStorage {

    private final Function<String, S3Client> clientFactory;
    private final Map<String, S3Client> clientsByEndpoint = new ConcurrentHashMap<>();

    @Autowired
    public S3ObjectStorage(final AwsCredentialsProvider credentialsProvider, final SdkHttpClient httpClient,
                           final ClientOverrideConfiguration overrideConfiguration, final Region region) {
        this(endpoint -> {
            log.info("Configuring S3Client for endpoint: {}", endpoint);
            return S3Client.builder()
                           .endpointOverride(URI.create(endpoint))
                           .forcePathStyle(true)
                           .region(region)
                           .credentialsProvider(credentialsProvider)
                           .httpClient(httpClient)
                           .overrideConfiguration(overrideConfiguration)
                           .build();
        });
        log.info("S3ObjectStorage initialized for region '{}'.", region);
    }

    S3ObjectStorage(final Function<String, S3Client> clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Override
    public List<StoredObject> list(final LocationDescriptor location, final String folder) {
        final String prefix = location.folderPath(folder) + "/";
        log.debug("Listing objects under '{}' in {}", prefix, location.describe());
        final ListObjectsV2Request request = ListObjectsV2Request.builder()
                                                                 .bucket(location.root())
                                                                 .prefix(prefix)
                                                                 .delimiter("/")
                                                                 .build();
        try {
            return clientFor(location).listObjectsV2Paginator(request).contents().stream()
                                      .filter(object -> object.key().length() > prefix.length())
                                      .map(object -> new StoredObject(object.key().substring(prefix.length()),
                                                                      object.size() == null ? 0 : object.size()))
                                      .toList();
        } catch (NoSuchBucketException e) {
            throw new StorageException("Bucket '" + location.root() + "' does not exist.", e);
        } catch (SdkException e) {
            throw new TransientStorageException("Failed to list '" + prefix + "' in " + location.describe(), e);
        }
    }

    @Override
    public byte[] download(final LocationDescriptor location, final String folder, final String name) {
        final String key = location.objectKey(folder, name);
        log.debug("Downloading object from key: {}", key);
        final GetObjectRequest request = GetObjectRequest.builder().bucket(location.root()).key(key).build();
        try {
            return clientFor(location).getObjectAsBytes(request).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new ObjectNotFoundException("Object '" + key + "' not found in " + location.describe(), e);
        } catch (SdkException e) {
            throw new TransientStorageException("Failed to download '" + key + "'", e);
        }
    }

    @Override
    public void upload(final LocationDescriptor location, final String folder, final String name,
                       final byte[] content) {
        final String key = location.objectKey(folder, name);
        final PutObjectRequest request = PutObjectRequest.builder().bucket(location.root()).key(key).build();
        try {
            clientFor(location).putObject(request, RequestBody.fromBytes(content));
            log.debug("Uploaded {} bytes to key: {}", content.length, key);
        } catch (SdkException e) {
            throw new TransientStorageException("Failed to upload '" + key + "'", e);
        }
    }

    @Override
    public void delete(final LocationDescriptor location, final String folder, final String name) {
        final String key = location.objectKey(folder, name);
        final DeleteObjectRequest request = DeleteObjectRequest.builder().bucket(location.root()).key(key).build();
        try {
            clientFor(location).deleteObject(request);
            log.info("Deleted object: {}", key);
        } catch (SdkException e) {
            throw new TransientStorageException("Failed to delete '" + key + "'", e);
        }
    }

    @PreDestroy
    public void closeClients() {
        clientsByEndpoint.values().forEach(S3Client::close);
        clientsByEndpoint.clear();
    }

    private S3Client clientFor(final LocationDescriptor location) {
        return clientsByEndpoint.computeIfAbsent(location.endpoint(), clientFactory);
    }
}
