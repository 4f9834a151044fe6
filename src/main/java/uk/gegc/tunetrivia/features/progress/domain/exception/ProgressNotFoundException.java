package uk.gegc.tunetrivia.features.progress.domain.exception;

import uk.gegc.tunetrivia.shared.exception.ResourceNotFoundException;

public class ProgressNotFoundException extends ResourceNotFoundException {

    public ProgressNotFoundException(String ownerId) {
        super("No progress snapshot for owner " + ownerId);
    }
}
