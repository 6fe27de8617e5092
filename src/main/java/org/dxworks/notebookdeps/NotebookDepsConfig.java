package org.dxworks.notebookdeps;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class NotebookDepsConfig {

    static final String CONFIG_FILE_NAME = "notebookdeps-config.yml";
    private static final boolean DEFAULT_PARALLEL = false;
    private static final boolean DEFAULT_PRETTY_PRINT = false;

    private final boolean parallel;
    private final boolean prettyPrint;

    private NotebookDepsConfig(boolean parallel, boolean prettyPrint) {
        this.parallel = parallel;
        this.prettyPrint = prettyPrint;
    }

    /** Analyze blocks on a parallel stream. Output order is the input order either way. */
    public boolean isParallel() {
        return parallel;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public static NotebookDepsConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    static NotebookDepsConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectiveParallel = yamlConfig.parallel != null ? yamlConfig.parallel : DEFAULT_PARALLEL;
                boolean effectivePrettyPrint = yamlConfig.prettyPrint != null ? yamlConfig.prettyPrint : DEFAULT_PRETTY_PRINT;
                return new NotebookDepsConfig(effectiveParallel, effectivePrettyPrint);
            }
        } catch (IOException e) {
            System.err.println("Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static NotebookDepsConfig defaults() {
        return new NotebookDepsConfig(DEFAULT_PARALLEL, DEFAULT_PRETTY_PRINT);
    }

    public static NotebookDepsConfig with(boolean parallel, boolean prettyPrint) {
        return new NotebookDepsConfig(parallel, prettyPrint);
    }

    private static class YamlConfig {
        public Boolean parallel;
        public Boolean prettyPrint;
    }
}
