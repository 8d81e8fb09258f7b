package com.pixelscript.render;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** Command lookup by case-insensitive name. */
public final class CommandRegistry {

    private final Map<String, PixelCommand> commands = new TreeMap<>();

    public static CommandRegistry withDefaults() {
        CommandRegistry r = new CommandRegistry();
        r.register(new ConfigCommand());
        r.register(new ColorCommand());
        r.register(new RegionCommand());
        r.register(new FillCommand());
        r.register(new VarCommand());
        return r;
    }

    public void register(PixelCommand command) {
        commands.put(command.name().toLowerCase(Locale.ROOT), command);
    }

    public PixelCommand get(String name) {
        return name == null ? null : commands.get(name.trim().toLowerCase(Locale.ROOT));
    }

    public Map<String, PixelCommand> all() {
        return Collections.unmodifiableMap(commands);
    }
}
