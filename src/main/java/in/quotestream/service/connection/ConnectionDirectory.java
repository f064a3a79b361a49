package in.quotestream.service.connection;

/**
 * Lookup of open connections by id.
 */
@FunctionalInterface
public interface ConnectionDirectory {

    /**
     * @return the open connection, or null if it is closed or unknown
     */
    ConnectionHandle find(String connectionId);
}
