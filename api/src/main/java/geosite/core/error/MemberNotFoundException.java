package geosite.core.error;

/**
 * A named list member does not exist in the archive.
 */
public class MemberNotFoundException extends GeositeException {

    private final String member;

    public MemberNotFoundException(String member) {
        super("file not found: " + member);
        this.member = member;
    }

    public String member() {
        return member;
    }
}
