package win.ixuni.cloudbulk.core.exception;

/**
 * Driver not found exception
 */
public class DriverNotFoundException extends CloudBulkException {

    public DriverNotFoundException(String driverName) {
        super("DriverNotFound", "The specified driver does not exist: " + driverName, 500);
    }
}
