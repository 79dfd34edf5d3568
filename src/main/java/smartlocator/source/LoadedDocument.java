package smartlocator.source;

import java.util.Objects;

/**
 * Markup plus where it came from.
 *
 * @param markup  the HTML to scan
 * @param source  the input as given (path, URL, or a preview of raw markup)
 * @param kind    how the markup was obtained
 * @param pageUrl address a browser can open to validate against; {@code null} for raw markup
 */
public record LoadedDocument(String markup, String source, Kind kind, String pageUrl) {

    public enum Kind { FILE, URL, RAW }

    public LoadedDocument {
        Objects.requireNonNull(markup, "markup");
        Objects.requireNonNull(kind, "kind");
    }

    /** True when the page can be opened in a browser, i.e. validation is possible. */
    public boolean isLive() {
        return pageUrl != null;
    }
}
