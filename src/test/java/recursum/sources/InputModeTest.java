package recursum.sources;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InputModeTest {

    @TempDir
    Path dir;

    @Test
    void of_resolvesEachInputShape() throws Exception {
        Path file = Files.writeString(dir.resolve("f.txt"), "x");

        assertEquals(InputMode.STDIN, InputMode.of(List.of("-")));
        assertEquals(InputMode.DIRECTORY, InputMode.of(List.of(dir.toString())));
        assertEquals(InputMode.FILES, InputMode.of(List.of(file.toString())));
        assertEquals(InputMode.FILES, InputMode.of(List.of(file.toString(), "missing")));
    }

    @Test
    void of_rejectsMissingSingleInputAndEmptyInput() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> InputMode.of(List.of(dir.resolve("missing").toString())));
        assertTrue(e.getMessage().contains("missing"));
        assertThrows(IllegalArgumentException.class, () -> InputMode.of(List.of()));
    }
}
