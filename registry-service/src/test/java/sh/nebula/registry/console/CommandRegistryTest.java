package sh.nebula.registry.console;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CommandRegistryTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private final List<String[]> invocations = new ArrayList<>();
    private CommandRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CommandRegistry(out);
        registry.register(new CommandHandler() {
            @Override
            public boolean execute(String[] args) {
                invocations.add(args);
                if (args.length > 1 && args[1].equals("boom")) {
                    throw new IllegalStateException("store offline");
                }
                return true;
            }

            @Override
            public String getName() {
                return "Echo";
            }

            @Override
            public String[] getAliases() {
                return new String[]{"e"};
            }

            @Override
            public String getDescription() {
                return "Echo arguments";
            }

            @Override
            public String getUsage() {
                return "echo [args]";
            }
        });
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Names and aliases resolve case-insensitively")
    void resolvesAliases() {
        assertThat(registry.getCommand("ECHO")).isNotNull();
        assertThat(registry.getCommand("E")).isSameAs(registry.getCommand("echo"));
        assertThat(registry.getCommand("missing")).isNull();
    }

    @Test
    @DisplayName("Input is split on whitespace")
    void splitsArguments() {
        assertThat(registry.executeCommand("  e   one  two ")).isTrue();

        assertThat(invocations).singleElement().satisfies(args ->
                assertThat(args).containsExactly("e", "one", "two"));
    }

    @Test
    @DisplayName("Blank input is ignored")
    void blankInput() {
        assertThat(registry.executeCommand("   ")).isFalse();
        assertThat(invocations).isEmpty();
        assertThat(output()).isEmpty();
    }

    @Test
    @DisplayName("Unknown commands point to help")
    void unknownCommand() {
        assertThat(registry.executeCommand("frobnicate")).isFalse();

        assertThat(output())
                .contains("Unknown command: frobnicate")
                .contains("Type 'help' for available commands");
    }

    @Test
    @DisplayName("Command failures are reported on the console")
    void commandFailure() {
        assertThat(registry.executeCommand("echo boom")).isFalse();

        assertThat(output()).contains("Error executing command: store offline");
    }
}
