package io.relaybroker.backend.disk;

/**
 * Shared constants for disk queue files.
 */
public final class DiskQueueConstant {
    /**
     * Infix between the queue name and the file number of a data file.
     */
    public static final String FILE_INFIX = ".diskqueue.";

    /**
     * File extension for data files.
     */
    public static final String DATA_EXT = ".dat";

    /**
     * Suffix appended to a data file that failed validation while being read.
     */
    public static final String BAD_EXT = ".bad";

    /**
     * Suffix of the metadata file, appended to the queue name.
     */
    public static final String META_SUFFIX = ".diskqueue.meta.dat";

    /**
     * 0x52424D51 == 'R' 'B' 'M' 'Q'
     */
    public static final int META_MAGIC = 0x5242_4D51;
    public static final short META_VERSION = 1;

    /**
     * Length + CRC in front of every record.
     */
    public static final int RECORD_HEADER_SIZE = Integer.BYTES * 2;

    private DiskQueueConstant() {
        // Prevent instantiation
    }
}
