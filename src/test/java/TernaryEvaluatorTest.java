import org.junit.jupiter.api.Test;

import com.pixelscript.debug.Diagnostic;
import com.pixelscript.debug.Diagnostics;
import com.pixelscript.script.control.ConditionEvaluator;
import com.pixelscript.script.control.TernaryEvaluator;
import com.pixelscript.script.expr.ExpressionCache;
import com.pixelscript.script.expr.ExpressionEvaluator;
import com.pixelscript.script.expr.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TernaryEvaluatorTest {

    private final Diagnostics diagnostics = new Diagnostics();
    private final ExpressionCache cache = new ExpressionCache();
    private final TernaryEvaluator ternary = new TernaryEvaluator(
            new ConditionEvaluator(diagnostics), new ExpressionEvaluator(cache, diagnostics), diagnostics);

    private static Map<String, Value> none() {
        return Collections.emptyMap();
    }

    @Test
    void selectsBranchByCondition() {
        assertEquals("10", ternary.evaluate("2>1?10:20", none()));
        assertEquals("20", ternary.evaluate("2<1?10:20", none()));
    }

    @Test
    void falseOuterConditionNeverTouchesTrueBranch() {
        assertEquals("b:c", ternary.evaluate("1>2?{1+1}?a:b:c", none()));
        assertEquals(0, cache.misses());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void nestedTernaryInSelectedBranchIsResolved() {
        Map<String, Value> v = new HashMap<>();
        v.put("x", Value.number(5));
        assertEquals("mid", ternary.evaluate("x>10?big:x>3?mid:small", v));
        v.put("x", Value.number(1));
        assertEquals("small", ternary.evaluate("x>10?big:x>3?mid:small", v));
        v.put("x", Value.number(20));
        assertEquals("big", ternary.evaluate("x>10?big:x>3?mid:small", v));
    }

    @Test
    void placeholdersInSelectedBranchAreEvaluated() {
        Map<String, Value> v = new HashMap<>();
        v.put("i", Value.number(4));
        assertEquals("c8", ternary.evaluate("i%2==0?c{i*2}:d{i}", v));
        assertEquals("16", ternary.evaluate("i>2?{i>3?{i*4}:0}:1", v));
    }

    @Test
    void textWithoutQuestionMarkIsReturnedAsIs() {
        assertEquals("plain", ternary.evaluate("plain", none()));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void missingColonIsReturnedUnchangedWithSyntaxDiagnostic() {
        assertEquals("1>0?yes", ternary.evaluate("1>0?yes", none()));
        assertEquals(1, diagnostics.count(Diagnostic.Kind.SYNTAX));
    }

    @Test
    void questionMarkInsideBracesDoesNotSplit() {
        assertFalse(TernaryEvaluator.isTernary("{a?b:c}"));
        assertTrue(TernaryEvaluator.isTernary("1>0?{a?b:c}:d"));
        assertEquals("x", ternary.evaluate("1>0?{1>0?x:y}:d", none()));
    }

    @Test
    void resolveSpansMixesTernariesAndExpressions() {
        Map<String, Value> v = new HashMap<>();
        v.put("n", Value.number(3));
        assertEquals("r6_odd", ternary.resolveSpans("r{n*2}_{n%2==1?odd:even}", v));
    }
}
