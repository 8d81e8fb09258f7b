package com.pixelscript.script;

import com.pixelscript.image.PixelBuffer;

/**
 * Host callback that executes one leaf instruction ({@code command:params})
 * against the current buffer. Implementations return the buffer to keep
 * using, which may be the same instance mutated in place or a new one.
 */
public interface LineExecutor {
    LineResult execute(String instruction, PixelBuffer buffer, int width, int height, int lineNumber);
}
