import org.junit.jupiter.api.Test;

import com.pixelscript.debug.Diagnostics;
import com.pixelscript.script.AdvancedProcessor;
import com.pixelscript.script.VariableStore;
import com.pixelscript.script.expr.Value;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class AdvancedProcessorTest {

    private final AdvancedProcessor ap = new AdvancedProcessor(new VariableStore(), new Diagnostics());

    @Test
    void splitParamsResolvesAgainstStore() {
        ap.variables().put("size", Value.number(10));
        assertEquals(Arrays.asList("r", "0|0", "9|9"), ap.splitParams("r\\0|0\\{size-1}|{size-1}"));
    }

    @Test
    void splitParamsResolvesTernaries() {
        ap.variables().put("n", Value.number(3));
        assertEquals(Arrays.asList("c", "odd"), ap.splitParams("c\\{n%2==1?odd:even}"));
    }

    @Test
    void storeChangesAreSeenByLaterCalls() {
        ap.variables().put("x", Value.number(1));
        assertEquals(Collections.singletonList("1"), ap.splitParams("{x}"));
        ap.variables().put("x", Value.number(2));
        assertEquals(Collections.singletonList("2"), ap.splitParams("{x}"));
    }

    @Test
    void resetForgetsEverything() {
        ap.variables().put("x", Value.number(1));
        ap.evaluateCached("x + 1", ap.variables().snapshot());
        ap.evaluateCached("nope +", Collections.emptyMap());
        assertEquals(1, ap.cache().size());
        assertFalse(ap.diagnostics().isEmpty());

        ap.reset();

        assertEquals(0, ap.variables().size());
        assertEquals(0, ap.cache().size());
        assertTrue(ap.diagnostics().isEmpty());
    }
}
