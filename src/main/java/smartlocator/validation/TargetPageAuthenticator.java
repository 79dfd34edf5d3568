package smartlocator.validation;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs another authenticator, then opens the page whose locators are about
 * to be validated, so validation always starts on the target page.
 */
public class TargetPageAuthenticator implements Authenticator {

    private static final Logger log = LoggerFactory.getLogger(TargetPageAuthenticator.class);

    private final Authenticator delegate;
    private final WebDriver     driver;
    private final String        targetUrl;

    public TargetPageAuthenticator(Authenticator delegate, WebDriver driver, String targetUrl) {
        this.delegate  = Objects.requireNonNull(delegate, "delegate");
        this.driver    = Objects.requireNonNull(driver, "driver");
        this.targetUrl = Objects.requireNonNull(targetUrl, "targetUrl");
    }

    @Override
    public void authenticate() {
        delegate.authenticate();
        try {
            driver.get(targetUrl);
            log.debug("Opened {} for validation", targetUrl);
        } catch (WebDriverException e) {
            throw new AuthenticationException("Cannot open " + targetUrl + " after login: "
                    + e.getClass().getSimpleName(), e);
        }
    }

    @Override
    public String describe() {
        return delegate.describe();
    }
}
