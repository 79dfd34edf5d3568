package smartlocator.validation;

import smartlocator.engine.SmartLocatorException;
import smartlocator.engine.Stage;

/**
 * Authentication against the live document failed. Aborts the validation
 * stage only; generated and scored candidates are still reported.
 */
public class AuthenticationException extends SmartLocatorException {

    public AuthenticationException(String msg) {
        super(Stage.AUTHENTICATION, msg);
    }

    public AuthenticationException(String msg, Throwable cause) {
        super(Stage.AUTHENTICATION, msg, cause);
    }
}
