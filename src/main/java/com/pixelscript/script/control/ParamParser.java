package com.pixelscript.script.control;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.pixelscript.script.expr.Value;
import com.pixelscript.script.text.InstructionTokenizer;

/** Backslash parameter splitting with placeholder resolution on each piece. */
public class ParamParser {

    private final TernaryEvaluator ternaries;

    public ParamParser(TernaryEvaluator ternaries) {
        this.ternaries = ternaries;
    }

    public List<String> splitParams(String text, Map<String, Value> variables) {
        List<String> raw = InstructionTokenizer.splitParams(text);
        List<String> out = new ArrayList<>(raw.size());
        for (String param : raw) {
            out.add(InstructionTokenizer.hasBraceSpan(param) ? ternaries.resolveSpans(param, variables) : param);
        }
        return out;
    }
}
