package org.kteam.mlcheck;

import java.io.IOException;

/**
 * Retrieves one monthly archive file.
 */
@FunctionalInterface
public interface MailFetcher {

    /**
     * Download the given URL.
     *
     * @param url Archive URL
     * @return Raw (still compressed) content, or null if the archive does not exist
     * @throws IOException on any other transfer failure
     */
    byte[] fetch(String url) throws IOException;
}
