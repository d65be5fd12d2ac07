package com.example.rowguard.authz.condition;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses condition strings into {@link Condition} values.
 *
 * <p>Grammar (tokens separated by whitespace):
 * <pre>
 * user with VALUE in CATEGORY
 * user with VALUE not in CATEGORY
 * user in owners CATEGORY
 * user not in owners CATEGORY
 * user is owner
 * user is not owner
 * resource is unowned
 * </pre>
 */
public final class ConditionParser {

    private static final int MAX_CACHED = 1024;

    private static final Map<String, Condition> CACHE = new ConcurrentHashMap<>();

    private ConditionParser() {}

    /**
     * @throws InvalidConditionException if the string is not a valid condition
     */
    public static Condition parse(String condition) {
        if (condition == null) {
            throw new InvalidConditionException("null");
        }
        Condition cached = CACHE.get(condition);
        if (cached != null) {
            return cached;
        }
        Condition parsed = doParse(condition);
        if (CACHE.size() < MAX_CACHED) {
            CACHE.putIfAbsent(condition, parsed);
        }
        return parsed;
    }

    /**
     * Parse every condition, failing on the first invalid one.
     */
    public static List<Condition> parseAll(List<String> conditions) {
        return conditions.stream().map(ConditionParser::parse).toList();
    }

    private static Condition doParse(String condition) {
        String[] w = condition.trim().split("\\s+");
        switch (w.length) {
            case 3 -> {
                if (is(w, "user", "is", "owner")) {
                    return new UserIsOwner();
                }
                if (is(w, "resource", "is", "unowned")) {
                    return new ResourceIsUnowned();
                }
            }
            case 4 -> {
                if (is(w, "user", "is", "not", "owner")) {
                    return new UserIsNotOwner();
                }
                if (w[0].equals("user") && w[1].equals("in") && w[2].equals("owners")) {
                    return new UserInOwnersList(w[3]);
                }
            }
            case 5 -> {
                if (w[0].equals("user") && w[1].equals("with") && w[3].equals("in")) {
                    return new UserWithValueInList(w[4], w[2]);
                }
                if (w[0].equals("user") && w[1].equals("not") && w[2].equals("in") && w[3].equals("owners")) {
                    return new UserNotInOwnersList(w[4]);
                }
            }
            case 6 -> {
                if (w[0].equals("user") && w[1].equals("with") && w[3].equals("not") && w[4].equals("in")) {
                    return new UserWithValueNotInList(w[5], w[2]);
                }
            }
            default -> {
                // no other arity is valid
            }
        }
        throw new InvalidConditionException(condition);
    }

    private static boolean is(String[] words, String... expected) {
        if (words.length != expected.length) {
            return false;
        }
        for (int i = 0; i < words.length; i++) {
            if (!words[i].equals(expected[i])) {
                return false;
            }
        }
        return true;
    }
}
