package sh.nebula.api.discovery;

/**
 * Well-known deployment environment tags.
 */
public final class Environments {

    public static final String WINDOWS_VM = "windows-vm";
    public static final String UBUNTU_HOME = "ubuntu-home";
    public static final String LINODE = "linode";
    public static final String REPLIT = "replit";
    public static final String DEVELOPMENT = "development";
    public static final String UNKNOWN = "unknown";

    /**
     * Environment of the GPU-capable node preferred for AI workloads.
     */
    public static final String PREFERRED_AI_ENVIRONMENT = WINDOWS_VM;

    private Environments() {
    }
}
