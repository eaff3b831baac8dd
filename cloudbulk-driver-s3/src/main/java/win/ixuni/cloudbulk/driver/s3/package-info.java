/**
 * S3 driver package
 * <p>
 * Bulk transfers against AWS S3 and S3-compatible backends (MinIO, LocalStack) on the AWS SDK v2
 * async client. File transfers go through {@code S3TransferManager} unless disabled.
 */
package win.ixuni.cloudbulk.driver.s3;
