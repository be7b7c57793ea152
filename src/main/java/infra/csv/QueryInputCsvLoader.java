package infra.csv;

import domain.model.QueryRequest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch question input.
 *
 * <pre>
 * id,query
 * q1,Show all products
 * q2,"How many TVs we have ? How many phones we have ?"
 * </pre>
 *
 * <p>{@code query} is required. A missing or blank {@code id} becomes
 * {@code row<n>}, n being the CSV record number. Rows with a blank query are
 * skipped.</p>
 */
public final class QueryInputCsvLoader {

    public List<QueryRequest> load(Path csvPath) {
        List<QueryRequest> out = new ArrayList<>();
        for (CsvSupport.CsvRow row : CsvSupport.read(csvPath, "query input", "query")) {
            String query = row.get("query").trim();
            if (query.isEmpty()) continue;

            String id = row.get("id").trim();
            if (id.isEmpty()) id = "row" + row.lineNo;
            out.add(new QueryRequest(id, query));
        }
        return out;
    }
}
