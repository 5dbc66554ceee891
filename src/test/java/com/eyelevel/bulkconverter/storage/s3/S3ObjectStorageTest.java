package com.eyelevel.bulkconverter.storage.s3;

import com.eyelevel.bulkconverter.exception.ObjectNotFoundException;
import com.eyelevel.bulkconverter.exception.StorageException;
import com.eyelevel.bulkconverter.exception.TransientStorageException;
import com.eyelevel.bulkconverter.model.LocationDescriptor;
import com.eyelevel.bulkconverter.model.StoredObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class S3ObjectStorageTest {

    private final LocationDescriptor location = new LocationDescriptor("https://s3.example.com", "bucket",
                                                                       List.of("root", "folder1"), "sig=1");
    private S3Client client;
    private List<String> createdFor;
    private S3ObjectStorage storage;

    @BeforeEach
    void setUp() {
        client = mock(S3Client.class);
        createdFor = new ArrayList<>();
        storage = new S3ObjectStorage(endpoint -> {
            createdFor.add(endpoint);
            return client;
        });
    }

    @Test
    void listReturnsNamesRelativeToTheFolder() {
        when(client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(
                ListObjectsV2Response.builder()
                                     .contents(S3Object.builder().key("root/folder1/files/").size(0L).build(),
                                               S3Object.builder().key("root/folder1/files/a.docx").size(12L).build(),
                                               S3Object.builder().key("root/folder1/files/b.pdf").size(7L).build())
                                     .isTruncated(false)
                                     .build());
        when(client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
                .thenAnswer(invocation -> new ListObjectsV2Iterable(client, invocation.getArgument(0)));

        List<StoredObject> objects = storage.list(location, "files");

        assertThat(objects).containsExactly(new StoredObject("a.docx", 12), new StoredObject("b.pdf", 7));
        ArgumentCaptor<ListObjectsV2Request> request = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(client).listObjectsV2(request.capture());
        assertThat(request.getValue().bucket()).isEqualTo("bucket");
        assertThat(request.getValue().prefix()).isEqualTo("root/folder1/files/");
        assertThat(request.getValue().delimiter()).isEqualTo("/");
    }

    @Test
    void missingBucketIsAPermanentStorageError() {
        when(client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
                .thenThrow(NoSuchBucketException.builder().message("no bucket").build());

        assertThatThrownBy(() -> storage.list(location, "files"))
                .isExactlyInstanceOf(StorageException.class)
                .hasMessageContaining("bucket");
    }

    @Test
    void downloadReadsTheKeyUnderThePrefix() {
        when(client.getObjectAsBytes(any(GetObjectRequest.class))).thenReturn(
                ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), new byte[]{4, 2}));

        assertThat(storage.download(location, "config", "start.txt")).containsExactly(4, 2);

        ArgumentCaptor<GetObjectRequest> request = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(client).getObjectAsBytes(request.capture());
        assertThat(request.getValue().key()).isEqualTo("root/folder1/config/start.txt");
    }

    @Test
    void missingKeyIsObjectNotFound() {
        when(client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        assertThatThrownBy(() -> storage.download(location, "files", "x.docx"))
                .isInstanceOf(ObjectNotFoundException.class);
    }

    @Test
    void networkErrorsAreTransient() {
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("connection reset"));

        assertThatThrownBy(() -> storage.upload(location, "converted", "x.pdf", new byte[]{1}))
                .isInstanceOf(TransientStorageException.class)
                .hasMessageContaining("root/folder1/converted/x.pdf");
    }

    @Test
    void deleteTargetsTheObjectKey() {
        storage.delete(location, "config", "start.txt");

        ArgumentCaptor<DeleteObjectRequest> request = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(client).deleteObject(request.capture());
        assertThat(request.getValue().key()).isEqualTo("root/folder1/config/start.txt");
    }

    @Test
    void oneClientIsBuiltPerEndpoint() {
        storage.delete(location, "config", "a.txt");
        storage.delete(location, "config", "b.txt");
        storage.delete(new LocationDescriptor("https://other.example.com", "bucket", List.of(), ""), "config", "c.txt");

        assertThat(createdFor).containsExactly("https://s3.example.com", "https://other.example.com");
    }
}
