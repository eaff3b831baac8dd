package win.ixuni.cloudbulk.core.model;

/**
 * Direction of a bulk transfer
 */
public enum TransferDirection {
    UPLOAD,
    DOWNLOAD
}
