package uk.gegc.tunetrivia.features.clipjob.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.tunetrivia.features.clipjob.api.dto.ClipJobAcceptedDto;
import uk.gegc.tunetrivia.features.clipjob.api.dto.StartClipJobRequest;
import uk.gegc.tunetrivia.features.clipjob.application.ClipJobRunner;
import uk.gegc.tunetrivia.features.clipjob.application.ClipJobService;
import uk.gegc.tunetrivia.features.clipjob.domain.model.ClipJobRequest;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

@Service
@RequiredArgsConstructor
@Slf4j
public class ClipJobServiceImpl implements ClipJobService {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final ClipJobRunner clipJobRunner;
    private final Clock clock;

    @Override
    public ClipJobAcceptedDto startJob(StartClipJobRequest request) {
        String sessionId = newSessionId();
        ClipJobRequest job = new ClipJobRequest(
                sessionId,
                request.ownerId(),
                request.urls().stream().map(String::trim).toList(),
                request.youtubeUrlIds()
        );
        clipJobRunner.runAsync(job);
        log.info("Clip job {} queued for {}", sessionId, request.ownerId());
        return new ClipJobAcceptedDto(sessionId, request.ownerId());
    }

    private String newSessionId() {
        StringBuilder suffix = new StringBuilder(9);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 9; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return "session_" + clock.millis() + "_" + suffix;
    }
}
