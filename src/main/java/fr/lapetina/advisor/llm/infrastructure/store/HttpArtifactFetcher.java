package fr.lapetina.advisor.llm.infrastructure.store;

import fr.lapetina.advisor.llm.domain.model.ModelId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Downloads artifacts from a Hugging Face style hub:
 * {@code {baseUrl}/{org}/{name}/resolve/main/{artifact}}.
 *
 * The body is written to a temporary file next to the target and moved into
 * place once complete.
 */
public class HttpArtifactFetcher implements ArtifactFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpArtifactFetcher.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpArtifactFetcher(String baseUrl, Duration connectTimeout, Duration requestTimeout) {
        Objects.requireNonNull(baseUrl, "Base URL is required");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "Request timeout is required");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Override
    public void fetch(ModelId modelId, String artifact, Path target) throws IOException {
        URI uri = URI.create(baseUrl + modelId.value() + "/resolve/main/" + artifact);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), artifact, ".part");
        Instant startTime = Instant.now();

        log.info("Downloading artifact: modelId={}, artifact={}, uri={}", modelId, artifact, uri);
        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .timeout(requestTimeout)
                    .GET()
                    .build();
            HttpResponse<Path> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofFile(temp));

            int statusCode = response.statusCode();
            if (statusCode < 200 || statusCode >= 300) {
                log.warn("Artifact download failed: modelId={}, artifact={}, status={}",
                        modelId, artifact, statusCode);
                throw new ArtifactDownloadException(uri, statusCode);
            }

            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Artifact downloaded: modelId={}, artifact={}, bytes={}, latencyMs={}",
                    modelId, artifact, Files.size(target), Duration.between(startTime, Instant.now()).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Download interrupted: " + uri);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
