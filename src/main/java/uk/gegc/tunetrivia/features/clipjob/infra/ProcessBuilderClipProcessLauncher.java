package uk.gegc.tunetrivia.features.clipjob.infra;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class ProcessBuilderClipProcessLauncher implements ClipProcessLauncher {

    @Override
    public Process start(List<String> command, Path workingDirectory) throws IOException {
        return new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .start();
    }
}
