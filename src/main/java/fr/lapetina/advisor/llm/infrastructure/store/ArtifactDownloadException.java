package fr.lapetina.advisor.llm.infrastructure.store;

import java.io.IOException;
import java.net.URI;

/**
 * The artifact server answered with a non-success status.
 */
public class ArtifactDownloadException extends IOException {

    private final int statusCode;

    public ArtifactDownloadException(URI uri, int statusCode) {
        super("Download failed: uri=" + uri + ", status=" + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
