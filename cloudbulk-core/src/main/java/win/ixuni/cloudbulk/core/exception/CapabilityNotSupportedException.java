package win.ixuni.cloudbulk.core.exception;

import lombok.Getter;
import win.ixuni.cloudbulk.core.driver.DriverCapabilities.Capability;

/**
 * Capability not supported exception
 * <p>
 * Thrown when the requested feature is not supported by the driver
 */
@Getter
public class CapabilityNotSupportedException extends CloudBulkException {

    private final Capability capability;
    private final String driverName;

    public CapabilityNotSupportedException(Capability capability, String driverName) {
        super("NotImplemented",
                String.format("The requested feature '%s' is not supported by driver '%s'",
                        capability.name(), driverName),
                501);
        this.capability = capability;
        this.driverName = driverName;
    }
}
