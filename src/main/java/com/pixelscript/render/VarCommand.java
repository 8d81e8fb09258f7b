package com.pixelscript.render;

import java.util.List;

import com.pixelscript.debug.Debug;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.script.LineResult;
import com.pixelscript.script.VariableStore;
import com.pixelscript.script.expr.Value;

/** {@code var:NAME\VALUE}; integer and decimal text become numbers. */
public class VarCommand extends BaseCommand {

    @Override
    public String name() { return "var"; }

    @Override
    public LineResult apply(List<String> params, DrawingContext context, PixelBuffer buffer, int width, int height) {
        if (params.size() < 2) {
            throw new CommandException("var needs NAME\\VALUE, got " + params.size() + " parameters");
        }
        String name = params.get(0);
        if (!VariableStore.isValidName(name)) {
            throw new CommandException("var: invalid name '" + name + "'");
        }
        Value value = Value.parseLiteral(params.get(1));
        context.variables().put(name, value);
        Debug.get().i(TAG, "var " + name + " = " + value);
        return LineResult.ok(buffer, width, height);
    }
}
