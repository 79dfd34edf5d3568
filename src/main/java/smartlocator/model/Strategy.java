package smartlocator.model;

/**
 * Generation strategy that produced a candidate, in priority order.
 * Each strategy produces exactly one {@link LocatorType}.
 */
public enum Strategy {
    /** {@code #id} */
    ID(LocatorType.CSS),
    /** {@code [data-testid="..."]}, {@code [name="..."]}, ... */
    ATTRIBUTE(LocatorType.CSS),
    /** {@code role=button[name="Save"s]} */
    ROLE(LocatorType.ROLE),
    /** {@code button.btn.btn-primary} */
    CLASS(LocatorType.CSS),
    /** {@code /html[1]/body[1]/form[1]/input[2]} */
    ABSOLUTE_XPATH(LocatorType.XPATH);

    private final LocatorType type;

    Strategy(LocatorType type) {
        this.type = type;
    }

    public LocatorType type() { return type; }
}
