package org.dxworks.notebookdeps;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.BatchFailure;
import org.dxworks.notebookdeps.model.BatchOutcome;
import org.dxworks.notebookdeps.model.Block;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Analyzes a whole notebook in one call: one result per block, in input order.
 * Only a broken container fails the batch; broken blocks fail individually.
 */
public class BatchAnalyzer {

    static final String BLOCKS_FIELD = "blocks";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Block>> BLOCK_LIST = new TypeReference<>() {};

    private final BlockDispatcher dispatcher;
    private final NotebookDepsConfig config;

    public BatchAnalyzer() {
        this(NotebookDepsConfig.defaults());
    }

    public BatchAnalyzer(NotebookDepsConfig config) {
        this(new BlockDispatcher(), config);
    }

    BatchAnalyzer(BlockDispatcher dispatcher, NotebookDepsConfig config) {
        this.dispatcher = dispatcher;
        this.config = config;
    }

    public BatchOutcome analyze(List<Block> blocks) {
        Stream<Block> stream = config.isParallel() ? blocks.parallelStream() : blocks.stream();
        // ordered collect: parallel mode still returns results in block order
        List<AnalysisResult> results = stream.map(dispatcher::dispatch).collect(Collectors.toList());
        return BatchOutcome.success(results);
    }

    /**
     * Accepts {@code {"blocks": [...]}} or a bare array of blocks and returns the serialized outcome:
     * the result array, or {@code {"errorMessage": ...}} when the container cannot be read.
     */
    public String analyzeJson(String json) {
        BatchOutcome outcome;
        try {
            outcome = analyze(readBlocks(json));
        } catch (IOException | RuntimeException e) {
            outcome = BatchOutcome.failure(BatchFailure.of(e));
        }
        return writeJson(outcome);
    }

    public String writeJson(BatchOutcome outcome) {
        ObjectWriter writer = config.isPrettyPrint()
                ? MAPPER.writerWithDefaultPrettyPrinter()
                : MAPPER.writer();
        try {
            return writer.writeValueAsString(outcome.toWireValue());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize batch outcome", e);
        }
    }

    static List<Block> readBlocks(String json) throws IOException {
        if (json == null || json.isBlank()) {
            throw new MalformedBatchException("empty batch input");
        }
        JsonNode root = MAPPER.readTree(json);
        JsonNode blocks = root.isArray() ? root : root.get(BLOCKS_FIELD);
        if (blocks == null || !blocks.isArray()) {
            throw new MalformedBatchException("expected a '" + BLOCKS_FIELD + "' array");
        }
        return MAPPER.convertValue(blocks, BLOCK_LIST);
    }
}
