package smartlocator.dom;

import smartlocator.engine.SmartLocatorException;
import smartlocator.engine.Stage;

/**
 * Input could not be interpreted as a document at all (empty, or no markup).
 * Fatal for the whole run.
 */
public class ParseException extends SmartLocatorException {

    public ParseException(String msg) {
        super(Stage.PARSE, msg);
    }

    public ParseException(String msg, Throwable cause) {
        super(Stage.PARSE, msg, cause);
    }
}
