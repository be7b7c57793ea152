package infra.csv;

import domain.translate.ProductPredicateTable;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Product predicate overrides.
 *
 * <pre>
 * product,predicate
 * TABLET,item_id LIKE 'TB%'
 * MONITOR,category = 'Monitors'
 * </pre>
 *
 * <p>Later rows win over earlier ones for the same product.</p>
 */
public final class ProductPredicateCsvLoader {

    public Map<String, String> load(Path csvPath) {
        Map<String, String> out = new LinkedHashMap<>();
        for (CsvSupport.CsvRow row : CsvSupport.read(csvPath, "product predicate", "product", "predicate")) {
            if (row.isBlank()) continue;

            String product = row.get("product").trim();
            String predicate = row.get("predicate").trim();
            if (product.isEmpty() || predicate.isEmpty()) {
                throw new IllegalArgumentException("product predicate csv line " + row.lineNo
                        + ": product and predicate are required: " + csvPath);
            }
            out.put(product.toUpperCase(Locale.ROOT), predicate);
        }
        return out;
    }

    /**
     * {@code base} with the file's rows applied on top.
     */
    public ProductPredicateTable loadOnto(ProductPredicateTable base, Path csvPath) {
        ProductPredicateTable table = base == null ? ProductPredicateTable.defaults() : base;
        return table.withMappings(load(csvPath));
    }
}
