package uk.gegc.tunetrivia.features.clipjob.application;

import uk.gegc.tunetrivia.features.clipjob.api.dto.ClipJobAcceptedDto;
import uk.gegc.tunetrivia.features.clipjob.api.dto.StartClipJobRequest;

public interface ClipJobService {

    /**
     * Start a clip job in the background.
     *
     * @return the job's session id; progress arrives on the owner's progress channel
     */
    ClipJobAcceptedDto startJob(StartClipJobRequest request);
}
