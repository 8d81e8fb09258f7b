import org.junit.jupiter.api.Test;

import com.pixelscript.debug.Debug;

import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a freshly loaded copy of the main classes, so no test that ran
 * earlier in this JVM can have installed a sink already.
 */
public class DebugHubTest {

    private static URLClassLoader freshLoader() {
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        return new URLClassLoader(new URL[] { classes }, ClassLoader.getPlatformClassLoader());
    }

    @Test
    void defaultSinkIsInstalledBeforeFirstUse() throws Exception {
        try (URLClassLoader loader = freshLoader()) {
            Class<?> debug = loader.loadClass("com.pixelscript.debug.Debug");
            assertNotSame(Debug.class, debug);

            Object hub = debug.getMethod("get").invoke(null);
            assertNotNull(debug.getMethod("getSink").invoke(hub));
            debug.getMethod("w", String.class, String.class).invoke(hub, "pixelscript.test", "dropped");
        }
    }

    @Test
    void runnerWorksWithoutAnyInstalledSink() throws Exception {
        try (URLClassLoader loader = freshLoader()) {
            Class<?> runnerClass = loader.loadClass("com.pixelscript.ScriptRunner");
            Object runner = runnerClass.getConstructor().newInstance();
            Object result = runnerClass.getMethod("runSource", String.class).invoke(runner, String.join("\n",
                    "config:4\\4\\0\\0\\0",
                    "var:x\\{1+1}",
                    "if:x==2;color:c\\1\\2\\3",
                    "loop:i\\0\\1\\1;region:r{i}\\{i}|0\\{i}|3"));

            Method stats = result.getClass().getMethod("stats");
            Object s = stats.invoke(result);
            assertEquals(4, s.getClass().getMethod("successLines").invoke(s));
            assertEquals(0, s.getClass().getMethod("failedLines").invoke(s));
        }
    }

    @Test
    void nullSinkRestoresNoOp() {
        Debug.get().setSink((level, tag, message, error) -> fail("should not be called"));
        Debug.get().setSink(null);
        Debug.get().e("pixelscript.test", "dropped");
        assertNotNull(Debug.get().getSink());
    }
}
