package sh.nebula.registry.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads commands line by line on a dedicated thread until stopped or end of input.
 */
public class InteractiveConsole implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(InteractiveConsole.class);
    private static final String PROMPT = "registry> ";

    private final CommandRegistry commandRegistry;
    private final InputStream in;
    private final PrintStream out;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consoleThread;

    public InteractiveConsole(CommandRegistry commandRegistry, InputStream in, PrintStream out) {
        this.commandRegistry = commandRegistry;
        this.in = in;
        this.out = out;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            consoleThread = new Thread(this, "Registry-Console");
            consoleThread.setDaemon(true);
            consoleThread.start();
            LOGGER.info("Interactive console started");
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (consoleThread != null) {
                consoleThread.interrupt();
            }
            LOGGER.info("Interactive console stopped");
        }
    }

    @Override
    public void run() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        out.println("Nebula Registry Interactive Console");
        out.println("Type 'help' for available commands");
        out.println();

        while (running.get()) {
            try {
                out.print(PROMPT);
                out.flush();
                String input = reader.readLine();
                if (input == null) {
                    break;
                }
                if (input.isBlank()) {
                    continue;
                }
                commandRegistry.executeCommand(input);
                out.println();
            } catch (IOException ex) {
                if (running.get()) {
                    LOGGER.error("Error reading console input", ex);
                }
                break;
            }
        }
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }
}
