package smartlocator.engine;

/**
 * Raised when an element ends up with no candidate at all. The absolute XPath
 * fallback makes this unreachable for a well-formed model, so seeing it means
 * the generator itself is broken.
 */
public class GenerationException extends SmartLocatorException {

    public GenerationException(String msg) {
        super(Stage.GENERATION, msg);
    }

    public GenerationException(String msg, Throwable cause) {
        super(Stage.GENERATION, msg, cause);
    }
}
