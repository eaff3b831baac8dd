package win.ixuni.cloudbulk.driver.gcs;

import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Bucket;
import com.google.cloud.storage.BucketInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;
import win.ixuni.cloudbulk.core.config.DriverConfig;
import win.ixuni.cloudbulk.core.exception.BucketAlreadyExistsException;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.exception.ObjectNotFoundException;
import win.ixuni.cloudbulk.core.model.ListObjectsPage;
import win.ixuni.cloudbulk.core.model.StorageObject;
import win.ixuni.cloudbulk.core.operation.bucket.CreateBucketOperation;
import win.ixuni.cloudbulk.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.cloudbulk.core.operation.object.DeleteObjectsOperation;
import win.ixuni.cloudbulk.core.operation.object.DownloadFileOperation;
import win.ixuni.cloudbulk.core.operation.object.ListObjectsOperation;
import win.ixuni.cloudbulk.core.operation.object.ObjectExistsOperation;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GcsStorageDriverTest {

    private static final String BUCKET = "gcs-test";

    @TempDir
    Path tempDir;

    private Storage storage;
    private GcsStorageDriver driver;

    @BeforeEach
    void setUp() {
        storage = mock(Storage.class);
        driver = new GcsStorageDriver(DriverConfig.of("gcs", "gcs", null), storage);
    }

    private static Blob blob(String key, long size) {
        Blob blob = mock(Blob.class);
        when(blob.getBucket()).thenReturn(BUCKET);
        when(blob.getName()).thenReturn(key);
        when(blob.getSize()).thenReturn(size);
        when(blob.getUpdateTimeOffsetDateTime()).thenReturn(OffsetDateTime.now());
        return blob;
    }

    @Test
    void testObjectExists() {
        BlobId present = BlobId.of(BUCKET, "present");
        Blob presentBlob = blob("present", 1);
        when(storage.get(present)).thenReturn(presentBlob);
        when(storage.get(BUCKET)).thenReturn(mock(Bucket.class));

        StepVerifier.create(driver.execute(new ObjectExistsOperation(BUCKET, "present")))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(driver.execute(new ObjectExistsOperation(BUCKET, "absent")))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(driver.execute(new ObjectExistsOperation("other-bucket", "absent")))
                .expectError(BucketNotFoundException.class)
                .verify();
    }

    @Test
    void testDownload() throws Exception {
        Blob blob = blob("docs/a.txt", 5);
        when(storage.get(BlobId.of(BUCKET, "docs/a.txt"))).thenReturn(blob);
        when(storage.get(BUCKET)).thenReturn(mock(Bucket.class));
        Path target = tempDir.resolve("a.txt");

        StorageObject object = driver.execute(new DownloadFileOperation(BUCKET, "docs/a.txt", target)).block();

        assertNotNull(object);
        assertEquals(5L, object.getSize());
        verify(blob).downloadTo(target);

        StepVerifier.create(driver.execute(new DownloadFileOperation(BUCKET, "missing", target)))
                .expectError(ObjectNotFoundException.class)
                .verify();
    }

    @Test
    void testUpload() throws Exception {
        Path source = Files.writeString(tempDir.resolve("up.txt"), "hello");
        Blob uploaded = blob("up.txt", 5);
        when(storage.createFrom(any(BlobInfo.class), eq(source))).thenReturn(uploaded);

        StorageObject object = driver.execute(UploadFileOperation.builder()
                .bucketName(BUCKET).key("up.txt").source(source).contentType("text/plain").build()).block();

        assertNotNull(object);
        assertEquals("up.txt", object.getKey());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testListPage() {
        List<Blob> blobs = List.of(blob("p/1", 1), blob("p/2", 2));
        Page<Blob> page = mock(Page.class);
        when(page.getValues()).thenReturn(blobs);
        when(page.getNextPageToken()).thenReturn("next-token");
        when(storage.list(eq(BUCKET), any(Storage.BlobListOption[].class))).thenReturn(page);

        ListObjectsPage result = driver.execute(ListObjectsOperation.builder()
                .bucketName(BUCKET).prefix("p/").maxKeys(2).build()).block();

        assertNotNull(result);
        assertEquals(List.of("p/1", "p/2"), result.getObjects().stream().map(StorageObject::getKey).toList());
        assertEquals("next-token", result.getNextContinuationToken());
        assertTrue(result.hasMore());
    }

    @Test
    void testDeleteObjectsInBatches() {
        when(storage.delete(anyIterable())).thenAnswer(invocation -> {
            Iterable<BlobId> ids = invocation.getArgument(0);
            List<Boolean> results = new ArrayList<>();
            ids.forEach(id -> results.add(!id.getName().startsWith("gone")));
            return results;
        });
        List<String> keys = IntStream.range(0, 150).mapToObj(i -> (i < 10 ? "gone-" : "k-") + i).toList();

        Integer deleted = driver.execute(new DeleteObjectsOperation(BUCKET, keys)).block();

        assertEquals(140, deleted);
        verify(storage, times(2)).delete(anyIterable());
    }

    @Test
    void testBucketErrorsAreTranslated() {
        when(storage.create(any(BucketInfo.class))).thenThrow(new StorageException(409, "Conflict"));
        when(storage.delete(BUCKET)).thenReturn(false);

        StepVerifier.create(driver.execute(new CreateBucketOperation(BUCKET)))
                .expectError(BucketAlreadyExistsException.class)
                .verify();
        StepVerifier.create(driver.execute(new DeleteBucketOperation(BUCKET)))
                .expectError(BucketNotFoundException.class)
                .verify();
    }
}
