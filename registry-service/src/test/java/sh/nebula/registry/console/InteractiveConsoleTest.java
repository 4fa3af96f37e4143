package sh.nebula.registry.console;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class InteractiveConsoleTest {

    @Test
    void runsEachLineUntilEndOfInput() throws InterruptedException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        List<String> seen = new CopyOnWriteArrayList<>();
        CommandRegistry commands = new CommandRegistry(out);
        commands.register(new CommandHandler() {
            @Override
            public boolean execute(String[] args) {
                seen.add(String.join(" ", args));
                return true;
            }

            @Override
            public String getName() {
                return "say";
            }

            @Override
            public String getDescription() {
                return "Record input";
            }

            @Override
            public String getUsage() {
                return "say <words>";
            }
        });
        byte[] input = "say hello\n\nsay bye\n".getBytes(StandardCharsets.UTF_8);
        InteractiveConsole console = new InteractiveConsole(commands, new ByteArrayInputStream(input), out);

        console.start();
        Instant deadline = Instant.now().plus(Duration.ofSeconds(5));
        while (console.isRunning() && Instant.now().isBefore(deadline)) {
            Thread.sleep(10);
        }

        assertThat(console.isRunning()).isFalse();
        assertThat(seen).containsExactly("say hello", "say bye");
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("registry> ");
    }
}
