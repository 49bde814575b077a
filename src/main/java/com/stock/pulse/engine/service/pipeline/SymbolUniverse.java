package com.stock.pulse.engine.service.pipeline;

import com.stock.pulse.engine.common.constants.DefaultUniverse;
import com.stock.pulse.engine.common.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Named symbol categories the scheduled runs extract. Changes apply from the next run.
 */
@Component
public class SymbolUniverse {

    private static final Pattern CATEGORY = Pattern.compile("[a-z0-9_]{1,64}");

    private final Map<String, LinkedHashSet<String>> categories = new LinkedHashMap<>();

    public SymbolUniverse() {
        categories.put(DefaultUniverse.NIFTY_50, new LinkedHashSet<>(DefaultUniverse.NIFTY_50_SYMBOLS));
        categories.put(DefaultUniverse.NIFTY_NEXT_50, new LinkedHashSet<>(DefaultUniverse.NIFTY_NEXT_50_SYMBOLS));
        categories.put(DefaultUniverse.MID_SMALL_CAPS, new LinkedHashSet<>(DefaultUniverse.MID_SMALL_CAP_SYMBOLS));
    }

    /**
     * Every tracked symbol once, in category order.
     */
    public synchronized List<String> all() {
        Set<String> out = new LinkedHashSet<>();
        categories.values().forEach(out::addAll);
        return new ArrayList<>(out);
    }

    public synchronized int size() {
        return all().size();
    }

    public synchronized Map<String, List<String>> categories() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        categories.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return out;
    }

    /**
     * Adds to {@code category} (default mid/small caps). Symbols tracked in any category already are reported, not moved.
     */
    public synchronized ChangeResult add(Collection<String> symbols, String category) {
        String cat = category == null || category.isBlank()
                ? DefaultUniverse.MID_SMALL_CAPS
                : category.trim().toLowerCase(Locale.ROOT);
        if (!CATEGORY.matcher(cat).matches()) throw new ValidationException("Invalid category name: " + category);

        Set<String> tracked = new LinkedHashSet<>(all());
        List<String> added = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        LinkedHashSet<String> target = categories.computeIfAbsent(cat, k -> new LinkedHashSet<>());
        for (String raw : symbols) {
            String s = clean(raw);
            if (s == null) continue;
            if (tracked.add(s)) {
                target.add(s);
                added.add(s);
            } else {
                unchanged.add(s);
            }
        }
        return new ChangeResult(added, unchanged, size());
    }

    public synchronized ChangeResult remove(Collection<String> symbols) {
        List<String> removed = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (String raw : symbols) {
            String s = clean(raw);
            if (s == null) continue;
            boolean hit = false;
            for (LinkedHashSet<String> members : categories.values()) {
                hit |= members.remove(s);
            }
            if (hit) removed.add(s);
            else notFound.add(s);
        }
        return new ChangeResult(removed, notFound, size());
    }

    static String clean(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        return s.isEmpty() ? null : s;
    }

    /**
     * {@code changed} were added/removed; {@code unchanged} already existed / were not found.
     */
    public record ChangeResult(List<String> changed, List<String> unchanged, int totalSymbols) {
    }
}
