package ai.rtlgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.rtlgraph.model.GraphOptions;

/**
 * Reads {@link GraphOptions} from a JSON file, e.g.
 * <pre>
 * { "omit": ["abort"], "callees": ["main"], "includeExternal": true, "summarizeCallers": 5 }
 * </pre>
 * Missing fields take their defaults; unknown fields are an error.
 */
public final class OptionsLoader {

    private final ObjectMapper mapper;

    public OptionsLoader() {
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public GraphOptions load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "config file not found");
        }
        try {
            final GraphOptions options = mapper.readValue(file.toFile(), GraphOptions.class);
            return options != null ? options : GraphOptions.DEFAULTS;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid config " + file + ": " + ex.getOriginalMessage(), ex);
        }
    }

    public GraphOptions parse(String json) {
        try {
            final GraphOptions options = mapper.readValue(json, GraphOptions.class);
            return options != null ? options : GraphOptions.DEFAULTS;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid config: " + ex.getOriginalMessage(), ex);
        }
    }
}
