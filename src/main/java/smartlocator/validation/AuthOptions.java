package smartlocator.validation;

import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Login settings for live validation, as given on the command line.
 *
 * <p>A storage-state file wins when it exists. Otherwise a form login is
 * used when every form field is set. Anything else means no authentication.
 */
public class AuthOptions {

    private static final Logger log = LoggerFactory.getLogger(AuthOptions.class);

    private Path   storageState;
    private String authUrl;
    private String user;
    private String password;
    private String userSelector;
    private String passSelector;
    private String submitSelector;
    private String waitSelector;
    private String waitUrlContains;

    public AuthOptions() {}

    // ── Queries ───────────────────────────────────────────────────────────

    public boolean hasStorageState() {
        return storageState != null && Files.isRegularFile(storageState);
    }

    public boolean isFormLoginComplete() {
        return present(authUrl) && user != null && password != null
                && present(userSelector) && present(passSelector) && present(submitSelector);
    }

    /** True when any login option was given at all. */
    public boolean isConfigured() {
        return storageState != null || present(authUrl) || present(userSelector)
                || present(passSelector) || present(submitSelector);
    }

    /**
     * Picks the authenticator these options describe, wrapped so that the
     * session ends on {@code targetUrl}.
     */
    public Authenticator toAuthenticator(WebDriver driver, String targetUrl, Duration timeout) {
        Authenticator login;
        if (hasStorageState()) {
            login = new StorageStateAuthenticator(driver, storageState, targetUrl);
        } else if (isFormLoginComplete()) {
            if (storageState != null) {
                log.warn("Storage state {} not found, falling back to form login", storageState);
            }
            login = new FormLoginAuthenticator(driver, this, timeout);
        } else {
            if (isConfigured()) {
                log.warn("Incomplete authentication options, validating without login");
            }
            login = NoAuthentication.INSTANCE;
        }
        return new TargetPageAuthenticator(login, driver, targetUrl);
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public Path   getStorageState()    { return storageState; }
    public String getAuthUrl()         { return authUrl; }
    public String getUser()            { return user; }
    public String getPassword()        { return password; }
    public String getUserSelector()    { return userSelector; }
    public String getPassSelector()    { return passSelector; }
    public String getSubmitSelector()  { return submitSelector; }
    public String getWaitSelector()    { return waitSelector; }
    public String getWaitUrlContains() { return waitUrlContains; }

    public AuthOptions setStorageState(Path storageState)      { this.storageState = storageState; return this; }
    public AuthOptions setAuthUrl(String authUrl)              { this.authUrl = blankToNull(authUrl); return this; }
    public AuthOptions setUser(String user)                    { this.user = user; return this; }
    public AuthOptions setPassword(String password)            { this.password = password; return this; }
    public AuthOptions setUserSelector(String userSelector)    { this.userSelector = blankToNull(userSelector); return this; }
    public AuthOptions setPassSelector(String passSelector)    { this.passSelector = blankToNull(passSelector); return this; }
    public AuthOptions setSubmitSelector(String submitSelector){ this.submitSelector = blankToNull(submitSelector); return this; }
    public AuthOptions setWaitSelector(String waitSelector)    { this.waitSelector = blankToNull(waitSelector); return this; }
    public AuthOptions setWaitUrlContains(String fragment)     { this.waitUrlContains = blankToNull(fragment); return this; }

    @Override
    public String toString() {
        return "AuthOptions{storageState=" + storageState + ", authUrl=" + authUrl
                + ", user=" + (user != null ? "***" : null) + "}";
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }

    private static String blankToNull(String s) {
        return present(s) ? s.trim() : null;
    }
}
