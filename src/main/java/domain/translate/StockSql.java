package domain.translate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One generated SELECT statement.
 *
 * <p>Keeps two forms side by side: the JDBC template with {@code ?}
 * placeholders plus its bind values, and the rendered text with the values
 * inlined as literals (what users and reports see). Executors must use the
 * template.</p>
 */
public final class StockSql {

    private final String template;
    private final List<Object> parameters;
    private final String rendered;

    private StockSql(String template, List<Object> parameters, String rendered) {
        this.template = template;
        this.parameters = Collections.unmodifiableList(parameters);
        this.rendered = rendered;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StockSql of(String sql) {
        return builder().append(sql).build();
    }

    public String getTemplate() {
        return template;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    /**
     * Statement text with bind values inlined (strings quoted, quotes doubled).
     */
    public String render() {
        return rendered;
    }

    static String literal(Object value) {
        if (value == null) return "NULL";
        if (value instanceof Number) return value.toString();
        return "'" + value.toString().replace("'", "''") + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StockSql)) return false;
        StockSql other = (StockSql) o;
        return template.equals(other.template) && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(template, parameters);
    }

    @Override
    public String toString() {
        return rendered;
    }

    public static final class Builder {
        private final StringBuilder template = new StringBuilder(96);
        private final StringBuilder rendered = new StringBuilder(96);
        private final List<Object> parameters = new ArrayList<>(2);

        private Builder() {
        }

        public Builder append(String sqlText) {
            template.append(sqlText);
            rendered.append(sqlText);
            return this;
        }

        public Builder bind(Object value) {
            Objects.requireNonNull(value, "bind value");
            template.append('?');
            rendered.append(literal(value));
            parameters.add(value);
            return this;
        }

        public StockSql build() {
            return new StockSql(template.toString(), new ArrayList<>(parameters), rendered.toString());
        }
    }
}
