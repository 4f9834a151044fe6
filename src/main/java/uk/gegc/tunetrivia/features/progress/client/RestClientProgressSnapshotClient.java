package uk.gegc.tunetrivia.features.progress.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.RestClient;
import uk.gegc.tunetrivia.features.progress.domain.model.ProgressEvent;

import java.util.Optional;

/**
 * Snapshot client over {@code /api/progress/{ownerId}}.
 */
@Slf4j
public class RestClientProgressSnapshotClient implements ProgressSnapshotClient {

    private static final String SNAPSHOT_PATH = "/api/progress/{ownerId}";

    private final RestClient restClient;

    public RestClientProgressSnapshotClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Optional<ProgressEvent> fetch(String ownerId) {
        return restClient.get()
                .uri(SNAPSHOT_PATH, ownerId)
                .exchange((request, response) -> {
                    if (response.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                        return Optional.empty();
                    }
                    if (response.getStatusCode().isError()) {
                        log.warn("Snapshot fetch for {} returned {}", ownerId, response.getStatusCode());
                        return Optional.empty();
                    }
                    return Optional.ofNullable(response.bodyTo(ProgressEvent.class));
                });
    }

    @Override
    public void clear(String ownerId) {
        restClient.delete()
                .uri(SNAPSHOT_PATH, ownerId)
                .retrieve()
                .toBodilessEntity();
    }
}
