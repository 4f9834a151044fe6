package uk.gegc.tunetrivia.features.clipjob.infra;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts the external clip process. Its stderr must be merged into stdout.
 */
@FunctionalInterface
public interface ClipProcessLauncher {

    Process start(List<String> command, Path workingDirectory) throws IOException;
}
