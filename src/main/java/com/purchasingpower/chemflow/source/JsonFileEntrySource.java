package com.purchasingpower.chemflow.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.chemflow.core.CalculationEntry;
import com.purchasingpower.chemflow.exception.InvalidInputException;
import com.purchasingpower.chemflow.model.CallContext;
import com.purchasingpower.chemflow.model.ServiceType;
import com.purchasingpower.chemflow.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads entries from a JSON array file:
 * <pre>
 * [
 *   {"id": "g1", "type": "geometry_optimization", "formula": "H2O",
 *    "cluster_key": "upload-1", "has_input_files": false, "has_output_files": true}
 * ]
 * </pre>
 * Unknown fields are ignored. Missing flags default to false.
 */
@Slf4j
public class JsonFileEntrySource implements EntrySource {

    private static final TypeReference<List<CalculationEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileEntrySource(Path file, ObjectMapper objectMapper) {
        this.file = Preconditions.checkNotNull(file, "File cannot be null");
        this.objectMapper = Preconditions.checkNotNull(objectMapper, "ObjectMapper cannot be null");
    }

    @Override
    public List<CalculationEntry> load() {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.ENTRY_SOURCE, "LoadJson", log);
        callCtx.logRequest("Reading entries", "File", file);

        try {
            List<CalculationEntry> entries = objectMapper.readValue(Files.readAllBytes(file), ENTRY_LIST);
            if (entries == null) {
                throw new InvalidInputException("Entry file " + file + " contains null instead of an array", List.of());
            }
            callCtx.logResponse("Entries read", "Count", entries.size());
            return entries;
        } catch (JsonProcessingException e) {
            callCtx.logError("Malformed entry file", e);
            throw new InvalidInputException("Malformed entry file " + file + ": "
                    + ExternalCallLogger.truncate(e.getOriginalMessage(), 200), List.of());
        } catch (IOException e) {
            callCtx.logError("Cannot read entry file", e);
            throw new UncheckedIOException("Cannot read entry file " + file, e);
        }
    }

    @Override
    public String describe() {
        return "json:" + file;
    }
}
