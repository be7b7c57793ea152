package domain.translate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical product token -> SQL predicate fragment.
 *
 * <p>Immutable. Lookups ignore case; unmapped tokens get {@link #ALWAYS_TRUE}.</p>
 */
public final class ProductPredicateTable {

    public static final String ALWAYS_TRUE = "1=1";

    private static final ProductPredicateTable DEFAULTS = new ProductPredicateTable(defaultMappings());

    private final Map<String, String> predicates;

    public ProductPredicateTable(Map<String, String> predicates) {
        Map<String, String> m = new LinkedHashMap<>();
        if (predicates != null) {
            for (Map.Entry<String, String> e : predicates.entrySet()) {
                m.put(key(e.getKey()), validate(e.getKey(), e.getValue()));
            }
        }
        this.predicates = Collections.unmodifiableMap(m);
    }

    public static ProductPredicateTable defaults() {
        return DEFAULTS;
    }

    private static Map<String, String> defaultMappings() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("TV", "item_id LIKE 'TV%'");

        m.put("PHONE", "item_id LIKE 'PH%'");
        m.put("MOBILE", "item_id LIKE 'PH%'");
        m.put("SMARTPHONE", "item_id LIKE 'PH%'");

        m.put("LAPTOP", "item_id LIKE 'LP%'");
        m.put("COMPUTER", "item_id LIKE 'LP%'");

        m.put("TABLET", "category = 'Tablets'");

        m.put("DRIVE", "item_id LIKE 'HD%'");
        m.put("HARD_DRIVE", "item_id LIKE 'HD%'");

        m.put("ALL", ALWAYS_TRUE);
        return m;
    }

    private static String key(String productType) {
        if (productType == null || productType.isBlank()) {
            throw new IllegalArgumentException("product type is blank");
        }
        return productType.trim().toUpperCase(Locale.ROOT);
    }

    // predicates are pasted into statement templates; placeholders or terminators would corrupt them
    private static String validate(String productType, String predicate) {
        if (predicate == null || predicate.isBlank()) {
            throw new IllegalArgumentException("predicate is blank for product type: " + productType);
        }
        String p = predicate.trim();
        if (p.indexOf('?') >= 0 || p.indexOf(';') >= 0 || p.contains("--")) {
            throw new IllegalArgumentException("predicate must not contain '?', ';' or '--': " + productType + " => " + p);
        }
        return p;
    }

    /**
     * @return predicate for the token, or null when unmapped
     */
    public String find(String productType) {
        if (productType == null || productType.isBlank()) return null;
        return predicates.get(key(productType));
    }

    public String predicateFor(String productType) {
        String p = find(productType);
        return p == null ? ALWAYS_TRUE : p;
    }

    public ProductPredicateTable withMapping(String productType, String predicate) {
        Map<String, String> m = new LinkedHashMap<>(predicates);
        m.put(key(productType), predicate);
        return new ProductPredicateTable(m);
    }

    /**
     * New table with {@code overrides} applied on top of this one.
     */
    public ProductPredicateTable withMappings(Map<String, String> overrides) {
        Map<String, String> m = new LinkedHashMap<>(predicates);
        if (overrides != null) {
            for (Map.Entry<String, String> e : overrides.entrySet()) m.put(key(e.getKey()), e.getValue());
        }
        return new ProductPredicateTable(m);
    }

    public List<String> supportedProducts() {
        return new ArrayList<>(predicates.keySet());
    }

    public int size() {
        return predicates.size();
    }
}
