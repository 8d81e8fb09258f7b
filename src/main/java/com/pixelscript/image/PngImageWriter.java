package com.pixelscript.image;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

/** Writes a {@link PixelBuffer} as a 32-bit RGBA PNG. */
public final class PngImageWriter {

    private PngImageWriter() {}

    public static void write(PixelBuffer buffer, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream out = Files.newOutputStream(target)) {
            write(buffer, out);
        }
    }

    public static void write(PixelBuffer buffer, OutputStream out) throws IOException {
        if (!ImageIO.write(buffer.toBufferedImage(), "png", out)) {
            throw new IOException("No PNG writer available");
        }
    }
}
