package org.dxworks.notebookdeps;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void analyzesNotebookFile() throws IOException {
        Path output = tempDir.resolve("out/result.json");
        int exitCode = App.run(Paths.get("src/test/resources/samples/notebook.json"), output, NotebookDepsConfig.defaults());

        assertEquals(App.EXIT_OK, exitCode);
        String json = Files.readString(output);
        assertTrue(json.startsWith("[{\"id\":\"load\",\"definedVariables\":[\"df\"],\"usedVariables\":[\"path\",\"pd\"],"
                + "\"importedModules\":[\"pd\"]}"), json);
        assertTrue(json.contains("{\"id\":\"summary\",\"definedVariables\":[\"total_amount\"],\"usedVariables\":[\"filtered\"],"
                + "\"importedModules\":[]}"), json);
        assertTrue(json.contains("\"id\":\"broken\""), json);
        assertTrue(json.contains("\"type\":\"TemplateSyntaxError\""), json);
    }

    @Test
    void missingInputIsATotalFailure() throws IOException {
        Path output = tempDir.resolve("result.json");
        int exitCode = App.run(tempDir.resolve("absent.json"), output, NotebookDepsConfig.defaults());

        assertEquals(App.EXIT_FAILURE, exitCode);
        assertTrue(Files.readString(output).startsWith("{\"errorMessage\":\"NoSuchFileException: "));
    }

    @Test
    void malformedContainerIsATotalFailure() throws IOException {
        Path input = tempDir.resolve("notebook.json");
        Files.writeString(input, "{\"cells\": []}");
        Path output = tempDir.resolve("result.json");

        assertEquals(App.EXIT_FAILURE, App.run(input, output, NotebookDepsConfig.defaults()));
        assertEquals("{\"errorMessage\":\"MalformedBatchException: expected a 'blocks' array\"}", Files.readString(output));
    }

    @Test
    void parsesNamedAndPositionalArguments() {
        Path[] named = App.parseArgs(new String[]{"--output", "out.json", "--input", "in.json"});
        assertEquals(Paths.get("in.json"), named[0]);
        assertEquals(Paths.get("out.json"), named[1]);

        Path[] positional = App.parseArgs(new String[]{"in.json", "out.json"});
        assertEquals(Paths.get("in.json"), positional[0]);
        assertEquals(Paths.get("out.json"), positional[1]);
    }

    @Test
    void rejectsIncompleteArguments() {
        assertNull(App.parseArgs(new String[]{}));
        assertNull(App.parseArgs(new String[]{"in.json"}));
        assertNull(App.parseArgs(new String[]{"--input", "in.json", "--verbose", "x"}));
        assertNull(App.parseArgs(new String[]{"--input", "in.json", "--input", "other.json"}));
    }
}
