package win.ixuni.cloudbulk.core.util;

import java.util.regex.Pattern;

/**
 * Bucket / container name validation
 * <p>
 * Applies the rules shared by S3, Azure Blob and GCS so bad names fail before any request is
 * sent; each SDK still enforces its own stricter rules.
 */
public class StorageValidationUtils {

    private static final Pattern BUCKET_NAME = Pattern.compile("^[a-z0-9][a-z0-9._-]*[a-z0-9]$");

    private static final Pattern IP_ADDRESS = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    /**
     * Validate a bucket name
     *
     * @param bucketName bucket name
     * @return error message, or null when the name is valid
     */
    public static String validateBucketName(String bucketName) {
        if (bucketName == null || bucketName.isEmpty()) {
            return "bucket name must not be empty";
        }
        if (bucketName.length() < 3 || bucketName.length() > 63) {
            return "bucket name must be between 3 and 63 characters long";
        }
        if (!BUCKET_NAME.matcher(bucketName).matches()) {
            return "bucket name may only contain lowercase letters, digits, '.', '-' and '_', "
                    + "and must start and end with a letter or digit";
        }
        if (bucketName.contains("..")) {
            return "bucket name must not contain two adjacent periods";
        }
        if (IP_ADDRESS.matcher(bucketName).matches()) {
            return "bucket name must not be formatted as an IP address";
        }
        return null;
    }
}
