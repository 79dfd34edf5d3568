package smartlocator.validation;

import org.mockito.Mock;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import smartlocator.model.AttributeKey;
import smartlocator.model.LocatorCandidate;
import smartlocator.model.LocatorType;
import smartlocator.model.Strategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class LocatorValidatorTest {

    @Mock private SelectorResolver resolver;

    private AutoCloseable mocks;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static LocatorCandidate css(String selector) {
        return LocatorCandidate.attributeBased(1, Strategy.ID, selector, AttributeKey.of("id", selector), "n");
    }

    // ── Per-candidate outcomes ────────────────────────────────────────────

    @Test(description = "Match counts, resolver errors and exceptions land on their own candidate")
    public void testOutcomesPerCandidate() {
        when(resolver.resolve(LocatorType.CSS, "#one")).thenReturn(ResolveResult.matched(1));
        when(resolver.resolve(LocatorType.CSS, "#many")).thenReturn(ResolveResult.matched(3));
        when(resolver.resolve(LocatorType.CSS, "#bad")).thenReturn(ResolveResult.failed("invalid selector"));
        when(resolver.resolve(LocatorType.CSS, "#boom"))
                .thenThrow(new IllegalStateException("driver crashed\nstack details"));

        LocatorCandidate one = css("#one");
        LocatorCandidate many = css("#many");
        LocatorCandidate bad = css("#bad");
        LocatorCandidate boom = css("#boom");
        ValidationSession session = ValidationSession.unauthenticated();

        ValidationOutcome outcome = new LocatorValidator(resolver, 2, Duration.ofSeconds(5))
                .validate(List.of(one, many, bad, boom), session);

        assertThat(one.getValidated()).isTrue();
        assertThat(one.getMatchCount()).isEqualTo(1);
        assertThat(one.getWarnings()).isEmpty();

        assertThat(many.getMatchCount()).isEqualTo(3);
        assertThat(many.getWarnings()).contains("Selector matched 3 elements");

        assertThat(bad.getValidated()).isTrue();
        assertThat(bad.getMatchCount()).isNull();
        assertThat(bad.getValidationError()).isEqualTo("invalid selector");

        assertThat(boom.getValidationError()).isEqualTo("driver crashed");

        assertThat(outcome.attempted()).isEqualTo(4);
        assertThat(outcome.resolved()).isEqualTo(2);
        assertThat(outcome.errors()).isEqualTo(2);
        assertThat(outcome.isAborted()).isFalse();
        assertThat(session.getState()).isEqualTo(ValidationSession.State.DONE);
    }

    @Test(description = "A slow resolve becomes a timeout error without holding up the others")
    public void testPerCallTimeout() {
        when(resolver.resolve(LocatorType.CSS, "#slow")).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return ResolveResult.matched(1);
        });
        when(resolver.resolve(LocatorType.CSS, "#fast")).thenReturn(ResolveResult.matched(1));

        LocatorCandidate slow = css("#slow");
        LocatorCandidate fast = css("#fast");

        new LocatorValidator(resolver, 2, Duration.ofMillis(300))
                .validate(List.of(slow, fast), ValidationSession.unauthenticated());

        assertThat(slow.getValidationError()).startsWith("Validation timed out");
        assertThat(fast.getMatchCount()).isEqualTo(1);
    }

    // ── Shared browser session ────────────────────────────────────────────

    @Test(description = "Waiting for a shared driver does not count against a call's timeout")
    public void testSharedDriverQueueIsNotTimedOut() {
        WebDriver driver = mock(WebDriver.class);
        List<WebElement> one = List.of(mock(WebElement.class));
        when(driver.findElements(any(By.class))).thenAnswer(inv -> {
            Thread.sleep(200);
            return one;
        });

        List<LocatorCandidate> candidates = new ArrayList<>();
        for (int i = 1; i <= 8; i++) candidates.add(css("#e" + i));

        ValidationOutcome outcome = new LocatorValidator(new WebDriverSelectorResolver(driver), 4, Duration.ofMillis(600))
                .validate(candidates, ValidationSession.unauthenticated());

        assertThat(candidates).allSatisfy(c -> {
            assertThat(c.getValidationError()).isNull();
            assertThat(c.getMatchCount()).isEqualTo(1);
        });
        assertThat(outcome.resolved()).isEqualTo(8);
        assertThat(outcome.errors()).isZero();
    }

    @Test(description = "A call that timed out on the shared driver does not eat into the next call's budget")
    public void testTimedOutCallReleasesDriverForNext() {
        WebDriver driver = mock(WebDriver.class);
        List<WebElement> one = List.of(mock(WebElement.class));
        when(driver.findElements(By.cssSelector("#hang"))).thenAnswer(inv -> {
            Thread.sleep(1_000);
            return one;
        });
        when(driver.findElements(By.cssSelector("#next"))).thenAnswer(inv -> {
            Thread.sleep(150);
            return one;
        });

        LocatorCandidate hang = css("#hang");
        LocatorCandidate next = css("#next");

        new LocatorValidator(new WebDriverSelectorResolver(driver), 4, Duration.ofMillis(400))
                .validate(List.of(hang, next), ValidationSession.unauthenticated());

        assertThat(hang.getValidationError()).startsWith("Validation timed out");
        assertThat(next.getValidationError()).isNull();
        assertThat(next.getMatchCount()).isEqualTo(1);
    }

    @Test
    public void webDriverResolver_servesOneCallAtATime() {
        assertThat(new WebDriverSelectorResolver(mock(WebDriver.class)).maxConcurrentCalls()).isEqualTo(1);
        assertThat(((SelectorResolver) (type, value) -> ResolveResult.matched(1)).maxConcurrentCalls())
                .isEqualTo(Integer.MAX_VALUE);
    }

    // ── Authentication ────────────────────────────────────────────────────

    @Test(description = "A lost login stops the run and leaves unrecorded candidates untouched")
    public void testAuthenticationLostMidRun() {
        when(resolver.resolve(LocatorType.CSS, "#first")).thenReturn(ResolveResult.matched(1));
        when(resolver.resolve(LocatorType.CSS, "#second")).thenThrow(new AuthenticationException("session expired"));
        when(resolver.resolve(LocatorType.CSS, "#third")).thenReturn(ResolveResult.matched(1));

        LocatorCandidate first = css("#first");
        LocatorCandidate second = css("#second");
        LocatorCandidate third = css("#third");
        ValidationSession session = ValidationSession.unauthenticated();

        ValidationOutcome outcome = new LocatorValidator(resolver, 1, Duration.ofSeconds(5))
                .validate(List.of(first, second, third), session);

        assertThat(first.getValidated()).isTrue();
        assertThat(second.getValidated()).isNull();
        assertThat(third.getValidated()).isNull();
        assertThat(third.getMatchCount()).isNull();
        assertThat(outcome.isAborted()).isTrue();
        assertThat(outcome.abortReason()).contains("session expired");
        assertThat(session.getState()).isEqualTo(ValidationSession.State.FAILED);
    }

    @Test(description = "A failed login skips every resolve")
    public void testLoginFailure() {
        Authenticator broken = new Authenticator() {
            @Override public void authenticate() { throw new AuthenticationException("bad credentials"); }
            @Override public String describe() { return "broken"; }
        };
        LocatorCandidate c = css("#x");

        ValidationOutcome outcome = new LocatorValidator(resolver, 1, Duration.ofSeconds(5))
                .validate(List.of(c), new ValidationSession(broken, Duration.ofSeconds(5)));

        verify(resolver, never()).resolve(any(), anyString());
        assertThat(c.getValidated()).isNull();
        assertThat(outcome.finalState()).isEqualTo(ValidationSession.State.FAILED);
        assertThat(outcome.attempted()).isZero();
    }

    @Test
    public void constructor_rejectsZeroThreads() {
        assertThatThrownBy(() -> new LocatorValidator(resolver, 0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threads");
    }
}
