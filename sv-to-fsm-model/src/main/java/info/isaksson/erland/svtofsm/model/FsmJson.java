package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON serialization of the extraction model.
 *
 * <p>Writing is deterministic: property order is fixed per type and map keys are sorted.</p>
 */
public final class FsmJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private FsmJson() {}

    public static String toJson(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        return write(fsm);
    }

    public static String toJson(ModuleAnalysis analysis) {
        if (analysis == null) throw new IllegalArgumentException("analysis is null");
        return write(analysis);
    }

    public static Fsm readFsm(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, Fsm.class);
    }

    public static ModuleAnalysis readModuleAnalysis(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, ModuleAnalysis.class);
    }

    private static String write(Object value) {
        try {
            return MAPPER.writer(PRETTY).writeValueAsString(value);
        } catch (IOException e) {
            // Only in-memory model types are written here.
            throw new UncheckedIOException(e);
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
