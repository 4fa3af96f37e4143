package sh.nebula.registry.environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.EnvironmentDetector;
import sh.nebula.api.discovery.Environments;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Works out which Nebula environment this host belongs to from configuration,
 * environment variables and well-known marker paths. The first answer is cached.
 */
public final class SystemEnvironmentDetector implements EnvironmentDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemEnvironmentDetector.class);

    static final Path HOMELAB_MARKER = Path.of("/opt/homelab");
    static final Path LINODE_MARKER = Path.of("/etc/linode");

    private final String configured;
    private final Function<String, String> env;
    private final String osName;
    private final Predicate<Path> pathExists;
    private volatile String cached;

    public SystemEnvironmentDetector(String configured) {
        this(configured, System::getenv, System.getProperty("os.name", ""), Files::exists);
    }

    public SystemEnvironmentDetector(String configured,
                                     Function<String, String> env,
                                     String osName,
                                     Predicate<Path> pathExists) {
        this.configured = configured;
        this.env = Objects.requireNonNull(env, "env");
        this.osName = osName == null ? "" : osName;
        this.pathExists = Objects.requireNonNull(pathExists, "pathExists");
    }

    @Override
    public String detectEnvironment() {
        String result = cached;
        if (result == null) {
            synchronized (this) {
                result = cached;
                if (result == null) {
                    result = detect();
                    cached = result;
                    LOGGER.info("Detected environment: {}", result);
                }
            }
        }
        return result;
    }

    private String detect() {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String explicit = variable("NEBULA_ENV");
        if (explicit != null) {
            return explicit;
        }
        if (variable("REPLIT_DEV_DOMAIN") != null || variable("REPL_ID") != null) {
            return Environments.REPLIT;
        }
        if (osName.toLowerCase(Locale.ROOT).startsWith("windows")) {
            return Environments.WINDOWS_VM;
        }
        if (pathExists.test(HOMELAB_MARKER)) {
            return Environments.UBUNTU_HOME;
        }
        if (variable("LINODE_ID") != null || pathExists.test(LINODE_MARKER)) {
            return Environments.LINODE;
        }
        return Environments.DEVELOPMENT;
    }

    private String variable(String name) {
        String value = env.apply(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
