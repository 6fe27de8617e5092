package org.dxworks.notebookdeps;

import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class AppApprovalTest {

    @TempDir
    Path tempDir;

    @Test
    void analyze_Notebook() throws IOException {
        Path output = tempDir.resolve("result.json");
        App.run(Paths.get("src/test/resources/samples/notebook.json"), output, NotebookDepsConfig.with(false, true));
        Approvals.verify(Files.readString(output));
    }
}
