package info.isaksson.erland.svtofsm.emitter;

import info.isaksson.erland.svtofsm.model.FsmOutput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OutputFormatterTest {

    @Test
    void shortensSingleBitLiterals() {
        assertEquals("busy=1", OutputFormatter.format(new FsmOutput("busy", "1'b1", 3)));
        assertEquals("busy=0", OutputFormatter.format(new FsmOutput("busy", "1'b0", 3)));
    }

    @Test
    void leavesWiderValuesAlone() {
        assertEquals("cnt=cnt + 4'd1", OutputFormatter.format(new FsmOutput("cnt", "cnt + 4'd1", 3)));
    }

    @Test
    void joinsListWithComma() {
        String s = OutputFormatter.format(List.of(new FsmOutput("a", "1'b1", 1), new FsmOutput("b", "x", 2)));
        assertEquals("a=1, b=x", s);
        assertEquals("", OutputFormatter.format(List.of()));
    }
}
