package info.isaksson.erland.svtofsm.emitter;

import info.isaksson.erland.svtofsm.model.FsmOutput;

import java.util.List;
import java.util.stream.Collectors;

/** Renders output assignments as {@code signal=value}, shortening single-bit literals. */
public final class OutputFormatter {

    private OutputFormatter() {}

    public static String format(FsmOutput output) {
        if (output == null) throw new IllegalArgumentException("output is null");
        String value = output.value.replace("1'b1", "1").replace("1'b0", "0");
        return output.signal + "=" + value;
    }

    public static String format(List<FsmOutput> outputs) {
        if (outputs == null || outputs.isEmpty()) return "";
        return outputs.stream().map(OutputFormatter::format).collect(Collectors.joining(", "));
    }
}
