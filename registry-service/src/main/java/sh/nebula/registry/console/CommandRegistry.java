package sh.nebula.registry.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name and alias lookup for console commands.
 */
public class CommandRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, CommandHandler> commands = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final PrintStream out;

    public CommandRegistry(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void register(CommandHandler handler) {
        String name = handler.getName().toLowerCase(Locale.ROOT);
        commands.put(name, handler);
        for (String alias : handler.getAliases()) {
            aliases.put(alias.toLowerCase(Locale.ROOT), name);
        }
        LOGGER.debug("Registered command: {} with {} aliases", name, handler.getAliases().length);
    }

    /**
     * Runs one line of input. Unknown commands and command failures are reported
     * on the console and never propagate.
     */
    public boolean executeCommand(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }

        String[] parts = input.trim().split("\\s+");
        CommandHandler handler = getCommand(parts[0]);
        if (handler == null) {
            out.println("Unknown command: " + parts[0]);
            out.println("Type 'help' for available commands");
            return false;
        }

        try {
            return handler.execute(parts);
        } catch (RuntimeException ex) {
            LOGGER.error("Error executing command: {}", handler.getName(), ex);
            out.println("Error executing command: " + ex.getMessage());
            return false;
        }
    }

    public Collection<CommandHandler> getAllCommands() {
        return commands.values();
    }

    /**
     * @return the handler for a name or alias, or null
     */
    public CommandHandler getCommand(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return commands.get(aliases.getOrDefault(key, key));
    }
}
