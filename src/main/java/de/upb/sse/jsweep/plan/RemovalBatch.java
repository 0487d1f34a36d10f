package de.upb.sse.jsweep.plan;

import de.upb.sse.jsweep.analysis.Category;
import de.upb.sse.jsweep.model.Symbol;
import lombok.Value;

import java.util.*;

/**
 * Symbols to delete in one pass, grouped by category in application order. A symbol appears at
 * most once.
 */
public final class RemovalBatch {

    @Value
    public static class Item {
        Category category;
        Symbol symbol;
    }

    private final Map<Category, List<Symbol>> symbols;

    RemovalBatch(Map<Category, List<Symbol>> symbols) {
        Map<Category, List<Symbol>> copy = new EnumMap<>(Category.class);
        symbols.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        this.symbols = Collections.unmodifiableMap(copy);
    }

    public static RemovalBatch empty() {
        return new RemovalBatch(Collections.emptyMap());
    }

    public List<Symbol> get(Category category) {
        return symbols.getOrDefault(category, Collections.emptyList());
    }

    public int count(Category category) {
        return get(category).size();
    }

    public int getTotal() {
        int total = 0;
        for (List<Symbol> list : symbols.values()) total += list.size();
        return total;
    }

    public boolean isEmpty() {
        return getTotal() == 0;
    }

    /** Every item in application order. */
    public List<Item> getItems() {
        List<Item> items = new ArrayList<>();
        for (Category category : Category.values()) {
            for (Symbol symbol : get(category)) items.add(new Item(category, symbol));
        }
        return items;
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "RemovalBatch{", "}");
        for (Category category : Category.values()) {
            if (count(category) > 0) joiner.add(category + "=" + count(category));
        }
        return joiner.toString();
    }
}
