package smartlocator.engine;

/**
 * Unchecked root of every fatal error raised by the locator pipeline.
 *
 * <p>The message is prefixed with the {@link Stage} label, e.g.
 * {@code "[parse] Input is empty"}, so CLI users can see which phase failed
 * without a stack trace.
 */
public class SmartLocatorException extends RuntimeException {

    private static final int MAX_INPUT_PREVIEW = 80;

    private final Stage stage;

    public SmartLocatorException(Stage stage, String msg) {
        super("[" + stage.label() + "] " + msg);
        this.stage = stage;
    }

    public SmartLocatorException(Stage stage, String msg, Throwable cause) {
        super("[" + stage.label() + "] " + msg, cause);
        this.stage = stage;
    }

    public Stage getStage() { return stage; }

    /**
     * Shortens offending input for inclusion in an error message.
     * Newlines are flattened and anything past 80 characters is cut.
     */
    public static String preview(String input) {
        if (input == null) return "<null>";
        String flat = input.replaceAll("\\s+", " ").trim();
        return flat.length() > MAX_INPUT_PREVIEW
                ? flat.substring(0, MAX_INPUT_PREVIEW) + "..."
                : flat;
    }
}
