package win.ixuni.cloudbulk.core.driver;

import java.util.Set;

/**
 * Driver capability descriptor
 * <p>
 * Lets a driver declare which groups of operations it supports. The transfer layer checks
 * capabilities before starting work that depends on them.
 */
public interface DriverCapabilities {

    /**
     * Driver capability enumeration
     */
    enum Capability {
        /**
         * Download, existence checks and listing
         */
        READ,

        /**
         * Upload and single-object delete
         */
        WRITE,

        /**
         * Deleting many keys in one operation
         */
        BATCH_DELETE,

        /**
         * Creating, checking and deleting buckets / containers
         */
        BUCKET_MANAGEMENT
    }

    /**
     * Get the set of capabilities supported by this driver
     *
     * @return the set of supported capabilities
     */
    Set<Capability> getCapabilities();

    /**
     * Check whether a specific capability is supported
     *
     * @param capability the capability to check
     * @return true if supported
     */
    default boolean supports(Capability capability) {
        return getCapabilities().contains(capability);
    }

    /**
     * Check whether all specified capabilities are supported
     *
     * @param capabilities the capabilities to check
     * @return true if all are supported
     */
    default boolean supportsAll(Capability... capabilities) {
        Set<Capability> caps = getCapabilities();
        for (Capability cap : capabilities) {
            if (!caps.contains(cap)) {
                return false;
            }
        }
        return true;
    }
}
