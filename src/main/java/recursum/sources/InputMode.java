package recursum.sources;

import java.nio.file.*;
import java.util.*;

// Which path source the command line inputs select.
public enum InputMode {
    DIRECTORY,
    FILES,
    STDIN;

    public static final String STDIN_MARKER = "-";

    /**
     * A single "-" reads standard input, a single directory is walked, anything else is a list
     * of files. A single input that does not exist is rejected.
     */
    public static InputMode of(List<String> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("No input given");
        }
        if (inputs.size() > 1) {
            return FILES;
        }
        String input = inputs.get(0);
        if (STDIN_MARKER.equals(input)) {
            return STDIN;
        }
        Path path = Path.of(input);
        if (Files.isDirectory(path)) {
            return DIRECTORY;
        }
        if (Files.isRegularFile(path)) {
            return FILES;
        }
        throw new IllegalArgumentException("Given input is not a directory, file, or - for stdin: " + input);
    }
}
