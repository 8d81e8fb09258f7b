import org.junit.jupiter.api.Test;

import com.pixelscript.script.text.InstructionTokenizer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InstructionTokenizerTest {

    @Test
    void backslashInsideBracesIsNotADelimiter() {
        assertEquals(Arrays.asList("a", "b{c\\d}", "e"), InstructionTokenizer.splitParams("a\\b{c\\d}\\e"));
    }

    @Test
    void paramsAreTrimmedAndInnerEmptiesKept() {
        assertEquals(Arrays.asList("a", "", "c"), InstructionTokenizer.splitParams(" a \\\\ c "));
        assertEquals(Arrays.asList("a", "b"), InstructionTokenizer.splitParams("a\\b\\"));
        assertEquals(Collections.emptyList(), InstructionTokenizer.splitParams("   "));
    }

    @Test
    void quotedParameterKeepsItsComma() {
        assertEquals(Arrays.asList("var:s\\'x,y'", "fill:a\\b"),
                InstructionTokenizer.splitInstructions("var:s\\'x,y',fill:a\\b"));
        assertEquals(Arrays.asList("color:c\\\"a,b\"\\1", "x:1"),
                InstructionTokenizer.splitInstructions("color:c\\\"a,b\"\\1,x:1"));
    }

    @Test
    void backslashQuoteInsideQuoteDoesNotClose() {
        assertEquals(Arrays.asList("'a\\',b'", "c"), InstructionTokenizer.splitInstructions("'a\\',b',c"));
    }

    @Test
    void quotesProtectDelimiters() {
        assertEquals(Arrays.asList("'a\\b'", "c"), InstructionTokenizer.splitParams("'a\\b'\\c"));
        assertEquals(Arrays.asList("\"x,y\"", "z"), InstructionTokenizer.splitInstructions("\"x,y\",z"));
    }

    @Test
    void otherQuoteKindDoesNotCloseTheActiveQuote() {
        assertEquals(Arrays.asList("\"it's, fine\"", "next"),
                InstructionTokenizer.splitInstructions("\"it's, fine\", next"));
    }

    @Test
    void unbalancedClosingBraceIsClampedToZero() {
        assertEquals(Arrays.asList("a}", "b"), InstructionTokenizer.splitParams("a}\\b"));
        assertEquals(Arrays.asList("a}", "b{c,d}"), InstructionTokenizer.splitInstructions("a},b{c,d}"));
    }

    @Test
    void instructionsAreTrimmedAndEmptiesDropped() {
        List<String> parts = InstructionTokenizer.splitInstructions(" color:a\\1\\2\\3 , , region:r\\0|0\\1|1 ,");
        assertEquals(Arrays.asList("color:a\\1\\2\\3", "region:r\\0|0\\1|1"), parts);
    }

    @Test
    void commaInsideBracesStaysInOneInstruction() {
        assertEquals(Arrays.asList("region:r\\{max(1, 2)}|0\\3|3", "fill:r\\c"),
                InstructionTokenizer.splitInstructions("region:r\\{max(1, 2)}|0\\3|3,fill:r\\c"));
    }

    @Test
    void replaceBraceSpansKeepsSpansTheResolverDeclines() {
        String out = InstructionTokenizer.replaceBraceSpans("a{1}b{skip}c{2{3}}",
                inner -> inner.equals("skip") ? null : "<" + inner + ">");
        assertEquals("a<1>b{skip}c<2{3}>", out);
    }

    @Test
    void unterminatedSpanIsCopiedThrough() {
        assertEquals("x<1>{y", InstructionTokenizer.replaceBraceSpans("x{1}{y", inner -> "<" + inner + ">"));
    }

    @Test
    void depthZeroSearchSkipsBracedText() {
        assertEquals(7, InstructionTokenizer.indexAtDepthZero("{a?b:c}?x:y", '?', 0));
        assertEquals(9, InstructionTokenizer.indexAtDepthZero("{a?b:c}?x:y", ':', 8));
        assertEquals(-1, InstructionTokenizer.indexAtDepthZero("{a?b}", '?', 0));
    }
}
