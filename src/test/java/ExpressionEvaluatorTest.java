import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Diagnostic;
import com.pixelscript.debug.Diagnostics;
import com.pixelscript.script.expr.ExpressionCache;
import com.pixelscript.script.expr.ExpressionEvaluator;
import com.pixelscript.script.expr.Value;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluatorTest {

    private final Diagnostics diagnostics = new Diagnostics();
    private final ExpressionCache cache = new ExpressionCache();
    private final ExpressionEvaluator ev = new ExpressionEvaluator(cache, diagnostics);

    private static Map<String, Value> vars(Object... kv) {
        Map<String, Value> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            Object v = kv[i + 1];
            m.put((String) kv[i], v instanceof Number ? Value.number(((Number) v).doubleValue()) : Value.string((String) v));
        }
        return m;
    }

    @BeforeAll
    static void debugHubAlwaysHasASink() {
        assertNotNull(Debug.get().getSink());
    }

    private String text(String expr) {
        return ev.evaluate(expr, vars()).toText();
    }

    @Test
    void largeIntegersPrintExactly() {
        assertEquals("1152921504606846976", text("2 ** 60"));
        assertEquals("-1152921504606846976", text("-(2 ** 60)"));
        assertEquals("100000000000000000000", text("10 ** 20"));
        assertEquals("8999999999999999", text("9 * 10 ** 15 - 1"));
    }

    @Test
    void arithmeticAndPrecedence() {
        assertEquals("14", text("2 + 3 * 4"));
        assertEquals("20", text("(2 + 3) * 4"));
        assertEquals("3.5", text("7 / 2"));
        assertEquals("512", text("2 ** 3 ** 2"));
        assertEquals("-4", text("-2 ** 2"));
        assertEquals("2", text("-7 % 3"));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void comparisonsAndLogic() {
        assertEquals("true", text("1 < 2 < 3"));
        assertEquals("false", text("3 > 2 > 2"));
        assertEquals("true", text("not 0 and (1 == 1.0)"));
        assertEquals("5", text("0 or 5"));
    }

    @Test
    void functionTableAndConstants() {
        assertEquals("5", text("max(1, 5, 3)"));
        assertEquals("-2", text("min(4, -2)"));
        assertEquals("2", text("round(2.5)"));
        assertEquals("3.14", text("round(3.14159, 2)"));
        assertEquals("-3", text("int(-3.7)"));
        assertEquals("4", text("sqrt(16)"));
        assertEquals("8", text("pow(2, 3)"));
        assertEquals("3", text("floor(3.9)"));
        assertEquals("4", text("ceil(3.1)"));
        assertEquals("7", text("abs(-7)"));
        assertEquals(Math.PI, ev.evaluate("pi", vars()).asNumber(), 1e-12);
        assertEquals(Math.E, ev.evaluate("e", vars()).asNumber(), 1e-12);
    }

    @Test
    void variablesResolveFromSnapshot() {
        assertEquals("42", ev.evaluate("x * 2", vars("x", 21)).toText());
        assertEquals("ab", ev.evaluate("a + b", vars("a", "a", "b", "b")).toText());
    }

    @Test
    void failuresYieldZeroWithEvaluationDiagnostic() {
        assertEquals(0.0, ev.evaluate("1 / 0", vars()).asNumber());
        assertEquals(0.0, ev.evaluate("missing + 1", vars()).asNumber());
        assertEquals(0.0, ev.evaluate("nosuchfn(1)", vars()).asNumber());
        assertEquals(0.0, ev.evaluate("1 +", vars()).asNumber());
        assertEquals(0.0, ev.evaluate("sqrt(-1)", vars()).asNumber());
        assertEquals(5, diagnostics.count(Diagnostic.Kind.EVALUATION));
        assertEquals(0, diagnostics.count(Diagnostic.Kind.SECURITY));
        assertNull(ev.tryEvaluate("x = 1", vars()));
    }

    @Test
    void disallowedConstructsAreRejectedNotExecuted() {
        String[] hostile = {
                "os.system('ls')",
                "__import__('os')",
                "import",
                "open('secret.txt')",
                "eval('1')",
                "x.__class__",
                "getattr(x, 'y')",
                "(1).real",
        };
        for (String expr : hostile) {
            Value v = ev.evaluate(expr, vars("x", 1));
            assertEquals(0.0, v.asNumber(), expr);
        }
        assertEquals(hostile.length, diagnostics.count(Diagnostic.Kind.SECURITY));
    }

    @Test
    void reservedNameStaysRejectedEvenWhenBound() {
        assertNull(ev.tryEvaluate("os + 1", vars("os", 1)));
        assertEquals(1, diagnostics.count(Diagnostic.Kind.SECURITY));
    }

    @Test
    void cachedEvaluationIsIdempotent() {
        Map<String, Value> v = vars("i", 3, "w", 10);
        Value first = ev.evaluateCached("i * w + 1", v);
        Value second = ev.evaluateCached("i * w + 1", v);
        assertEquals(first, second);
        assertEquals("31", second.toText());
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
    }

    @Test
    void snapshotOrderDoesNotMatter() {
        Map<String, Value> a = vars("i", 1, "j", 2);
        Map<String, Value> b = new HashMap<>();
        b.put("j", Value.number(2));
        b.put("i", Value.number(1));
        ev.evaluateCached("i + j", a);
        ev.evaluateCached("i + j", b);
        assertEquals(1, cache.hits());
    }

    @Test
    void changedVariableInvalidatesCachedResult() {
        Map<String, Value> v = vars("i", 1);
        assertEquals("2", ev.evaluateCached("i + 1", v).toText());
        v.put("i", Value.number(5));
        assertEquals("6", ev.evaluateCached("i + 1", v).toText());
        assertEquals(0, cache.hits());
        assertEquals(2, cache.size());
    }

    @Test
    void anyExtraBindingChangesTheKey() {
        ev.evaluateCached("1 + 1", vars("a", 1));
        ev.evaluateCached("1 + 1", vars("a", 1, "b", 2));
        assertEquals(0, cache.hits());
        assertEquals(2, cache.size());
    }

    @Test
    void failedResultsAreNotCached() {
        ev.evaluateCached("1 / 0", vars());
        ev.evaluateCached("1 / 0", vars());
        assertEquals(0, cache.size());
        assertEquals(2, diagnostics.count(Diagnostic.Kind.EVALUATION));
    }

    @Test
    void disabledCacheStoresNothing() {
        cache.setEnabled(false);
        assertEquals("2", ev.evaluateCached("1 + 1", vars()).toText());
        assertEquals("2", ev.evaluateCached("1 + 1", vars()).toText());
        assertEquals(0, cache.size());
        assertEquals(0, cache.hits());
    }

    @Test
    void substituteBracesReplacesTopLevelSpans() {
        assertEquals("r2_6", ev.substituteBraces("r{1+1}_{x*2}", vars("x", 3)));
        assertEquals("7", ev.substituteBraces("{1+{2*3}}", vars()));
        assertEquals("2.5|10", ev.substituteBraces("{5/2}|{x*5}", vars("x", 2)));
        assertEquals("no braces", ev.substituteBraces("no braces", vars()));
    }

    @Test
    void failedSpanIsLeftIntact() {
        assertEquals("a{1/0}b", ev.substituteBraces("a{1/0}b", vars()));
        assertEquals("{os.name}", ev.substituteBraces("{os.name}", vars()));
        assertEquals("open{", ev.substituteBraces("open{", vars()));
    }
}
