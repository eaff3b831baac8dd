package win.ixuni.cloudbulk.driver.s3.interceptor;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.s3.model.S3Exception;
import win.ixuni.cloudbulk.core.exception.BucketAlreadyExistsException;
import win.ixuni.cloudbulk.core.exception.BucketNotEmptyException;
import win.ixuni.cloudbulk.core.exception.BucketNotFoundException;
import win.ixuni.cloudbulk.core.exception.CloudBulkException;
import win.ixuni.cloudbulk.core.exception.ObjectNotFoundException;
import win.ixuni.cloudbulk.core.operation.bucket.CreateBucketOperation;
import win.ixuni.cloudbulk.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.cloudbulk.core.operation.object.DownloadFileOperation;
import win.ixuni.cloudbulk.core.operation.object.ObjectExistsOperation;
import win.ixuni.cloudbulk.core.operation.object.UploadFileOperation;

import java.nio.file.Path;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class S3ExceptionTranslationInterceptorTest {

    private final S3ExceptionTranslationInterceptor interceptor = new S3ExceptionTranslationInterceptor();

    private static S3Exception s3Error(int status, String code) {
        return (S3Exception) S3Exception.builder()
                .statusCode(status)
                .message(code)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).build())
                .build();
    }

    @Test
    void testErrorCodes() {
        DownloadFileOperation download = new DownloadFileOperation("bucket", "key", Path.of("out"));

        assertInstanceOf(BucketNotFoundException.class,
                interceptor.translateException(download, s3Error(404, "NoSuchBucket")));
        ObjectNotFoundException notFound = assertInstanceOf(ObjectNotFoundException.class,
                interceptor.translateException(download, s3Error(404, "NoSuchKey")));
        assertTrue(notFound.getMessage().contains("key"));
        assertInstanceOf(BucketNotEmptyException.class,
                interceptor.translateException(new DeleteBucketOperation("bucket"), s3Error(409, "BucketNotEmpty")));
        assertInstanceOf(BucketAlreadyExistsException.class,
                interceptor.translateException(new CreateBucketOperation("bucket"), s3Error(409, "BucketAlreadyOwnedByYou")));
        assertInstanceOf(BucketAlreadyExistsException.class,
                interceptor.translateException(new CreateBucketOperation("bucket"), s3Error(409, "BucketAlreadyExists")));
    }

    @Test
    void testBare404() {
        assertInstanceOf(ObjectNotFoundException.class,
                interceptor.translateException(new ObjectExistsOperation("bucket", "key"), s3Error(404, null)));
        assertInstanceOf(BucketNotFoundException.class,
                interceptor.translateException(new DeleteBucketOperation("bucket"), s3Error(404, null)));
        UploadFileOperation upload = UploadFileOperation.builder()
                .bucketName("bucket").key("key").source(Path.of("in")).build();
        assertInstanceOf(BucketNotFoundException.class, interceptor.translateException(upload, s3Error(404, null)));
    }

    @Test
    void testUnmappedErrorPassesThrough() {
        S3Exception denied = s3Error(403, "AccessDenied");
        assertSame(denied, interceptor.translateException(new CreateBucketOperation("bucket"), denied));
    }

    @Test
    void testInterceptUnwrapsCompletionException() {
        CreateBucketOperation operation = new CreateBucketOperation("bucket");

        StepVerifier.create(interceptor.intercept(operation, null,
                        (op, ctx) -> Mono.error(new CompletionException(s3Error(409, "BucketAlreadyExists")))))
                .expectError(BucketAlreadyExistsException.class)
                .verify();
    }

    @Test
    void testInterceptKeepsCloudBulkExceptions() {
        CloudBulkException original = new CloudBulkException("Custom", "custom", 500, s3Error(404, "NoSuchKey"));

        StepVerifier.create(interceptor.intercept(new CreateBucketOperation("bucket"), null,
                        (op, ctx) -> Mono.error(original)))
                .expectErrorSatisfies(e -> assertSame(original, e))
                .verify();
    }
}
