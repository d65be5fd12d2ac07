package com.example.rowguard.sqlstore.authorized;

import com.example.rowguard.authz.model.ProtectedResource;
import com.example.rowguard.authz.model.User;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stored row seen as a {@link ProtectedResource}.
 *
 * <p>The owner is a synthetic {@code system} user carrying the attributes captured when the row
 * was inserted. Rows without captured attributes are owned by {@link #PUBLIC_OWNER}, which has
 * none, so they are public. A stored value that is not a JSON object marks the row's ownership
 * as unreadable, and such rows are denied to everyone.
 */
public record SqlRecord(
        String table,
        String identifier,
        @Nullable Map<String, List<String>> accessAttributes,
        boolean attributesUnreadable
) implements ProtectedResource {

    public static final String TYPE_PREFIX = "sql_record::";
    public static final String SYSTEM_PRINCIPAL = "system";
    public static final User PUBLIC_OWNER = new User("system_public", null);

    private static final String ID_COLUMN = "id";
    private static final String UNKNOWN_ID = "unknown";

    public SqlRecord(String table, String identifier, @Nullable Map<String, List<String>> accessAttributes) {
        this(table, identifier, accessAttributes, false);
    }

    /**
     * Adapt a row as returned by the store.
     */
    public static SqlRecord fromRow(String table, Map<String, Object> row) {
        Object id = row.get(ID_COLUMN);
        Object stored = row.get(AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN);
        return new SqlRecord(
                table,
                id != null ? id.toString() : UNKNOWN_ID,
                toAttributes(stored),
                stored != null && !(stored instanceof Map<?, ?>));
    }

    @Override
    public String type() {
        return TYPE_PREFIX + table;
    }

    @Override
    public boolean hasUnreadableOwnership() {
        return attributesUnreadable;
    }

    @Override
    public boolean isPublic() {
        return !attributesUnreadable && ProtectedResource.super.isPublic();
    }

    @Override
    public User owner() {
        if (accessAttributes == null || accessAttributes.isEmpty()) {
            return PUBLIC_OWNER;
        }
        return new User(SYSTEM_PRINCIPAL, accessAttributes);
    }

    // A scalar stored under a category counts as a single value, as JSON set functions treat it.
    @Nullable
    static Map<String, List<String>> toAttributes(@Nullable Object stored) {
        if (!(stored instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, List<String>> attributes = new LinkedHashMap<>();
        map.forEach((category, values) -> {
            if (values == null) {
                attributes.put(String.valueOf(category), null);
            } else if (values instanceof Collection<?> collection) {
                List<String> strings = new ArrayList<>(collection.size());
                for (Object value : collection) {
                    if (value != null) {
                        strings.add(value.toString());
                    }
                }
                attributes.put(String.valueOf(category), strings);
            } else {
                attributes.put(String.valueOf(category), List.of(values.toString()));
            }
        });
        return attributes;
    }
}
