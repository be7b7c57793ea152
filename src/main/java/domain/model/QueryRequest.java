package domain.model;

/**
 * One question to process, with the id it is reported under.
 */
public final class QueryRequest {

    private final String id;
    private final String query;

    public QueryRequest(String id, String query) {
        this.id = id == null ? "" : id.trim();
        this.query = query == null ? "" : query;
    }

    public String getId() {
        return id;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String toString() {
        return id + ": " + query;
    }
}
