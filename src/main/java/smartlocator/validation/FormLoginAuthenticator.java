package smartlocator.validation;

import org.openqa.selenium.By;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Logs in by filling a username/password form with CSS selectors, then
 * waits for either a post-login selector or a URL fragment.
 */
public class FormLoginAuthenticator implements Authenticator {

    private static final Logger log = LoggerFactory.getLogger(FormLoginAuthenticator.class);

    private final WebDriver   driver;
    private final AuthOptions options;
    private final Duration    waitTimeout;

    public FormLoginAuthenticator(WebDriver driver, AuthOptions options, Duration waitTimeout) {
        this.driver      = Objects.requireNonNull(driver, "driver");
        this.options     = Objects.requireNonNull(options, "options");
        this.waitTimeout = Objects.requireNonNull(waitTimeout, "waitTimeout");
        if (!options.isFormLoginComplete()) {
            throw new IllegalArgumentException("Form login needs auth URL, user, password and the three selectors");
        }
    }

    @Override
    public void authenticate() {
        WebDriverWait wait = new WebDriverWait(driver, waitTimeout);
        try {
            driver.get(options.getAuthUrl());
            fill(wait, options.getUserSelector(), options.getUser());
            fill(wait, options.getPassSelector(), options.getPassword());
            wait.until(ExpectedConditions.elementToBeClickable(By.cssSelector(options.getSubmitSelector()))).click();

            if (options.getWaitSelector() != null) {
                wait.until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(options.getWaitSelector())));
            } else if (options.getWaitUrlContains() != null) {
                wait.until(ExpectedConditions.urlContains(options.getWaitUrlContains()));
            }
            log.info("Form login succeeded at {}", options.getAuthUrl());
        } catch (TimeoutException e) {
            throw new AuthenticationException("Login did not complete within " + waitTimeout.toSeconds()
                    + "s at " + options.getAuthUrl(), e);
        } catch (WebDriverException e) {
            throw new AuthenticationException("Login failed at " + options.getAuthUrl() + ": "
                    + e.getClass().getSimpleName(), e);
        }
    }

    @Override
    public String describe() {
        return "form login at " + options.getAuthUrl();
    }

    private static void fill(WebDriverWait wait, String selector, String value) {
        WebElement field = wait.until(ExpectedConditions.visibilityOfElementLocated(By.cssSelector(selector)));
        field.clear();
        field.sendKeys(value);
    }
}
