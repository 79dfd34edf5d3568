package smartlocator.validation;

/** Brings the browser session into a logged-in state before validation. */
public interface Authenticator {

    /**
     * @throws AuthenticationException if the login could not be completed
     */
    void authenticate();

    /** Short description for logs, never containing credentials. */
    String describe();
}
