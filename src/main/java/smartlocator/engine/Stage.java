package smartlocator.engine;

/**
 * Pipeline stage named in every fatal error so a failure can be traced to the
 * phase that raised it.
 */
public enum Stage {
    LOAD("load"),
    PARSE("parse"),
    GENERATION("generation"),
    AUTHENTICATION("authentication"),
    VALIDATION("validation"),
    EXPORT("export");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
