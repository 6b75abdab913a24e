package in.timeos.domain.common;

/**
 * Levels of the agency scope chain, narrowest first.
 *
 * Each level maps to a {@code scope_<level>_id} column on both the signals and issues tables.
 * PERSON is carried on signals only; patterns never group on it.
 */
public enum ScopeLevel {
    TASK("scope_task_id"),
    PROJECT("scope_project_id"),
    RETAINER("scope_retainer_id"),
    BRAND("scope_brand_id"),
    CLIENT("scope_client_id"),
    PERSON("scope_person_id");

    private final String column;

    ScopeLevel(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public boolean isIssueScope() {
        return this != PERSON;
    }

    public static ScopeLevel fromString(String value) {
        return ScopeLevel.valueOf(value.trim().toUpperCase());
    }
}
