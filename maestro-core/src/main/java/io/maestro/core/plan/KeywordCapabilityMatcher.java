package io.maestro.core.plan;

import io.maestro.core.agent.AgentDefinition.StandardTypes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Whole-word keyword matcher.
///
/// Each capability owns a set of keywords; a keyword may be a phrase. Matching is
/// case-insensitive on word boundaries, and the last word of a keyword also matches its plural
/// (`lead` matches `leads`, `quote` matches `quotes`). Every known capability name is a keyword
/// for itself, with `_` and `-` read as spaces, so agents declaring new capabilities are
/// reachable without extra configuration.
///
/// @implNote Thread-safe. Keywords may be added while matching is in progress.
public class KeywordCapabilityMatcher implements CapabilityMatcher {

    private final Map<String, Set<String>> vocabulary = new ConcurrentHashMap<>();
    private final Map<String, Integer> declarationOrder = new ConcurrentHashMap<>();

    /// Creates a matcher with the business vocabulary.
    ///
    /// @return matcher, never null
    public static KeywordCapabilityMatcher standard() {
        return new KeywordCapabilityMatcher()
                .withKeywords(
                        StandardTypes.CRM, "lead", "customer", "opportunity", "crm", "contact")
                .withKeywords(StandardTypes.SALES, "sale", "sales", "order", "quotation", "quote")
                .withKeywords(StandardTypes.INVENTORY, "stock", "inventory", "warehouse", "product")
                .withKeywords(
                        StandardTypes.ACCOUNTING,
                        "account",
                        "accounting",
                        "financial",
                        "invoice",
                        "payment",
                        "bill")
                .withKeywords(
                        StandardTypes.HR, "employee", "hr", "attendance", "recruitment", "payroll");
    }

    /// Adds keywords for a capability.
    ///
    /// @param capability capability name, not null
    /// @param keywords words or phrases, not null
    /// @return this matcher
    public KeywordCapabilityMatcher withKeywords(String capability, String... keywords) {
        String key = capability.toLowerCase(Locale.ROOT);
        declarationOrder.putIfAbsent(key, declarationOrder.size());
        Set<String> words = vocabulary.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet());
        for (String keyword : keywords) {
            words.add(keyword.toLowerCase(Locale.ROOT));
        }
        return this;
    }

    /// Returns the keywords registered for a capability.
    public Set<String> keywordsFor(String capability) {
        return Set.copyOf(vocabulary.getOrDefault(capability.toLowerCase(Locale.ROOT), Set.of()));
    }

    @Override
    public List<String> match(String text, Set<String> knownCapabilities) {
        List<String> tokens = tokenize(text);
        Map<String, Integer> positions = new LinkedHashMap<>();

        List<String> capabilities = new ArrayList<>(vocabulary.keySet());
        capabilities.sort(
                (a, b) -> Integer.compare(declarationOrder.get(a), declarationOrder.get(b)));
        Set<String> candidates = new LinkedHashSet<>(capabilities);
        candidates.addAll(knownCapabilities);

        for (String capability : candidates) {
            Set<String> keywords =
                    new LinkedHashSet<>(vocabulary.getOrDefault(capability, Set.of()));
            keywords.add(capability);
            int best = -1;
            for (String keyword : keywords) {
                int position = find(tokens, tokenize(keyword));
                if (position >= 0 && (best < 0 || position < best)) {
                    best = position;
                }
            }
            if (best >= 0) {
                positions.put(capability, best);
            }
        }

        List<String> result = new ArrayList<>(positions.keySet());
        result.sort((a, b) -> Integer.compare(positions.get(a), positions.get(b)));
        return result;
    }

    private static int find(List<String> tokens, List<String> phrase) {
        if (phrase.isEmpty()) {
            return -1;
        }
        outer:
        for (int i = 0; i + phrase.size() <= tokens.size(); i++) {
            for (int j = 0; j < phrase.size(); j++) {
                String token = tokens.get(i + j);
                String word = phrase.get(j);
                boolean last = j == phrase.size() - 1;
                if (!token.equals(word)
                        && !(last && (token.equals(word + "s") || token.equals(word + "es")))) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    static List<String> tokenize(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> !token.isEmpty())
                .toList();
    }
}
