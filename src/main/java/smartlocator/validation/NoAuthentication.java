package smartlocator.validation;

/** Public pages: nothing to do. */
public final class NoAuthentication implements Authenticator {

    public static final NoAuthentication INSTANCE = new NoAuthentication();

    private NoAuthentication() {}

    @Override
    public void authenticate() {
        // no-op
    }

    @Override
    public String describe() {
        return "none";
    }
}
