package com.example.rowguard.sqlstore.authorized;

import com.example.rowguard.authz.engine.AccessPolicies;
import com.example.rowguard.authz.engine.AccessPolicyEngine;
import com.example.rowguard.authz.exception.AccessDeniedException;
import com.example.rowguard.authz.model.AccessRule;
import com.example.rowguard.authz.model.Action;
import com.example.rowguard.authz.model.Scope;
import com.example.rowguard.authz.model.User;
import com.example.rowguard.observability.metrics.AccessMetrics;
import com.example.rowguard.sqlstore.ColumnDefinition;
import com.example.rowguard.sqlstore.ColumnType;
import com.example.rowguard.sqlstore.FetchQuery;
import com.example.rowguard.sqlstore.JdbcSqlStore;
import com.example.rowguard.sqlstore.OrderBy;
import com.example.rowguard.sqlstore.PaginatedResult;
import com.example.rowguard.sqlstore.SqlStore;
import com.example.rowguard.sqlstore.dialect.SqliteDialect;
import com.example.rowguard.util.SqliteTestSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.rowguard.util.UserTestBuilder.aUser;
import static com.example.rowguard.util.UserTestBuilder.aViewer;
import static com.example.rowguard.util.UserTestBuilder.anAdmin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AuthorizedSqlStore")
class AuthorizedSqlStoreTest {

    private static final String TABLE = "documents";

    private SingleConnectionDataSource dataSource;
    private JdbcSqlStore sqlStore;
    private SimpleMeterRegistry registry;
    private AuthorizedSqlStore store;

    @BeforeEach
    void setUp() {
        dataSource = SqliteTestSupport.inMemoryDataSource();
        sqlStore = SqliteTestSupport.sqliteStore(dataSource);
        registry = new SimpleMeterRegistry();
        store = new AuthorizedSqlStore(
                sqlStore,
                new AccessControlWhereClauseBuilder(new SqliteDialect(), true),
                AccessPolicies.defaultPolicy(),
                new AccessMetrics(registry));

        Map<String, ColumnDefinition> schema = new LinkedHashMap<>();
        schema.put("id", ColumnDefinition.primaryKey(ColumnType.STRING));
        schema.put("title", ColumnDefinition.of(ColumnType.STRING));
        schema.put("created_at", ColumnDefinition.of(ColumnType.INTEGER));
        store.createTableWithAccessControl(TABLE, schema);
    }

    @AfterEach
    void tearDown() {
        dataSource.destroy();
    }

    private void insert(User user, String id, int createdAt) {
        store.insert(user, TABLE, Map.of("id", id, "title", "doc " + id, "created_at", createdAt));
    }

    private static List<Object> ids(PaginatedResult result) {
        return result.data().stream().map(row -> row.get("id")).toList();
    }

    @Nested
    @DisplayName("default policy scenarios")
    class Scenarios {

        @Test
        @DisplayName("should show admin rows to admins and hide them from viewers")
        void shouldSeparateRoles() {
            insert(anAdmin(), "admin-doc", 1);
            insert(aViewer(), "viewer-doc", 2);

            assertThat(ids(store.fetchAll(anAdmin(), TABLE, FetchQuery.all()))).containsExactly("admin-doc");
            assertThat(ids(store.fetchAll(aViewer(), TABLE, FetchQuery.all()))).containsExactly("viewer-doc");
            assertThat(ids(store.fetchAll(null, TABLE, FetchQuery.all()))).isEmpty();
        }

        @Test
        @DisplayName("should show a teams-only row to team members regardless of role")
        void shouldShowTeamsOnlyRow() {
            insert(aUser().withAttribute("teams", "ml").build(), "ml-doc", 1);
            User mlViewer = aUser().withAttribute("roles", "viewer").withAttribute("teams", "ml").build();
            User infraAdmin = aUser().withAttribute("roles", "admin").withAttribute("teams", "infra").build();

            assertThat(ids(store.fetchAll(mlViewer, TABLE, FetchQuery.all()))).containsExactly("ml-doc");
            assertThat(ids(store.fetchAll(infraAdmin, TABLE, FetchQuery.all()))).isEmpty();
        }

        @Test
        @DisplayName("should store anonymous inserts as public rows visible to everyone")
        void shouldMakeAnonymousInsertsPublic() {
            insert(null, "public-doc", 1);
            insert(aUser().withoutAttributes().build(), "bare-doc", 2);

            Map<String, Object> row = sqlStore.fetchOne(TABLE, FetchQuery.matching(Map.of("id", "public-doc")));
            assertThat(row).containsEntry(AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN, null);

            for (User user : new User[]{null, anAdmin(), aViewer()}) {
                assertThat(ids(store.fetchAll(user, TABLE, FetchQuery.builder()
                        .orderBy(List.of(OrderBy.asc("created_at"))).build())))
                        .containsExactly("public-doc", "bare-doc");
            }
        }

        @Test
        @DisplayName("should overwrite caller-supplied access attributes")
        void shouldOverwriteSuppliedAttributes() {
            store.insert(aViewer(), TABLE, Map.of(
                    "id", "forged",
                    AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN, Map.of("roles", List.of("admin"))));

            assertThat(ids(store.fetchAll(aViewer(), TABLE, FetchQuery.all()))).containsExactly("forged");
            assertThat(ids(store.fetchAll(anAdmin(), TABLE, FetchQuery.all()))).isEmpty();
        }

        @Test
        @DisplayName("should return the first readable row from fetchOne, or null")
        void shouldFetchOne() {
            insert(anAdmin(), "a", 1);
            insert(aViewer(), "b", 2);

            FetchQuery newestFirst = FetchQuery.builder().orderBy(List.of(OrderBy.desc("created_at"))).build();

            assertThat(store.fetchOne(aViewer(), TABLE, newestFirst)).containsEntry("id", "b");
            assertThat(store.fetchOne(null, TABLE, newestFirst)).isNull();
        }

        @Test
        @DisplayName("should combine the caller's whereSql with the access predicate")
        void shouldCombineWhereSql() {
            insert(anAdmin(), "a", 1);
            insert(anAdmin(), "b", 5);
            insert(aViewer(), "c", 9);

            FetchQuery query = FetchQuery.builder()
                    .whereSql("created_at > :after")
                    .whereSqlParameters(Map.of("after", 2))
                    .build();

            assertThat(ids(store.fetchAll(anAdmin(), TABLE, query))).containsExactly("b");
        }
    }

    @Nested
    @DisplayName("rows whose access attributes are not an object")
    class MalformedAttributes {

        @BeforeEach
        void insertMalformedRows() {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
            jdbcTemplate.update("INSERT INTO " + TABLE + " (id, access_attributes) VALUES ('array', '[\"admin\"]')");
            jdbcTemplate.update("INSERT INTO " + TABLE + " (id, access_attributes) VALUES ('string', '\"admin\"')");
            jdbcTemplate.update("INSERT INTO " + TABLE + " (id, access_attributes) VALUES ('number', '42')");
            insert(null, "public-doc", 1);
        }

        @Test
        @DisplayName("should hide them from every user, anonymous included")
        void shouldHideFromEveryone() {
            for (User user : new User[]{null, anAdmin(), aViewer(), aUser().withoutAttributes().build()}) {
                assertThat(ids(store.fetchAll(user, TABLE, FetchQuery.all())))
                        .as("rows visible to %s", user)
                        .containsExactly("public-doc");
            }
        }

        @Test
        @DisplayName("should hide them under a conservative pre-filter too")
        void shouldHideUnderCustomPolicy() {
            List<AccessRule> permitAll = List.of(AccessRule.permit(Scope.allActions(), List.of()));

            assertThat(ids(store.fetchAll(anAdmin(), TABLE, permitAll, FetchQuery.all()))).containsExactly("public-doc");
        }

        @Test
        @DisplayName("should deny updates and deletes of them")
        void shouldDenyWrites() {
            assertThatThrownBy(() -> store.update(anAdmin(), TABLE, Map.of("title", "changed"), Map.of("id", "array")))
                    .isInstanceOf(AccessDeniedException.class);
            assertThatThrownBy(() -> store.delete(null, TABLE, Map.of("id", "number")))
                    .isInstanceOf(AccessDeniedException.class);

            assertThat(sqlStore.fetchAll(TABLE, FetchQuery.all()).data()).hasSize(4);
        }
    }

    @Nested
    @DisplayName("cursor paging")
    class CursorPaging {

        private FetchQuery after(String cursorId) {
            return FetchQuery.builder()
                    .orderBy(List.of(OrderBy.desc("created_at")))
                    .cursorColumn("created_at")
                    .cursorId(cursorId)
                    .build();
        }

        @Test
        @DisplayName("should page after a readable cursor row")
        void shouldPageAfterReadableCursor() {
            insert(aViewer(), "v1", 1);
            insert(anAdmin(), "secret", 2);
            insert(aViewer(), "v3", 3);

            assertThat(ids(store.fetchAll(aViewer(), TABLE, after("v3")))).containsExactly("v1");
            assertThat(ids(store.fetchAll(anAdmin(), TABLE, after("secret")))).isEmpty();
        }

        @Test
        @DisplayName("should reject a hidden cursor row exactly like a missing one")
        void shouldNotRevealHiddenCursorRows() {
            insert(aViewer(), "v1", 1);
            insert(anAdmin(), "secret", 2);

            Throwable hidden = catchThrowable(() -> store.fetchAll(aViewer(), TABLE, after("secret")));
            Throwable missing = catchThrowable(() -> store.fetchAll(aViewer(), TABLE, after("nope")));

            assertThat(hidden)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage(FetchQuery.cursorNotFound(TABLE, "secret").getMessage());
            assertThat(missing)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage(FetchQuery.cursorNotFound(TABLE, "nope").getMessage());
            assertThatThrownBy(() -> store.fetchAll(null, TABLE, after("secret")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage(FetchQuery.cursorNotFound(TABLE, "secret").getMessage());
        }
    }

    @Nested
    @DisplayName("consistency between SQL pre-filter and evaluator")
    class Consistency {

        private final List<String> categories = AccessPolicies.OWNER_CATEGORIES;
        private final AccessControlWhereClauseBuilder builder = new AccessControlWhereClauseBuilder(new SqliteDialect(), true);

        // Per category a row is unrestricted, restricted to nothing ([]), or restricted to "x".
        private List<Map<String, List<String>>> rowVariants() {
            List<Map<String, List<String>>> variants = new ArrayList<>();
            variants.add(new LinkedHashMap<>());
            for (String category : categories) {
                List<Map<String, List<String>>> next = new ArrayList<>();
                for (Map<String, List<String>> variant : variants) {
                    next.add(variant);
                    Map<String, List<String>> empty = new LinkedHashMap<>(variant);
                    empty.put(category, List.of());
                    next.add(empty);
                    Map<String, List<String>> restricted = new LinkedHashMap<>(variant);
                    restricted.put(category, List.of("x"));
                    next.add(restricted);
                }
                variants = next;
            }
            return variants;
        }

        // Per category a user lacks it, holds the row's value, holds another value, or holds both.
        private List<User> userVariants() {
            List<Map<String, List<String>>> variants = new ArrayList<>();
            variants.add(new LinkedHashMap<>());
            for (String category : categories) {
                List<Map<String, List<String>>> next = new ArrayList<>();
                for (Map<String, List<String>> variant : variants) {
                    next.add(variant);
                    for (List<String> values : List.of(List.of("x"), List.of("y"), List.of("y", "x"))) {
                        Map<String, List<String>> held = new LinkedHashMap<>(variant);
                        held.put(category, values);
                        next.add(held);
                    }
                }
                variants = next;
            }
            List<User> users = new ArrayList<>();
            for (int i = 0; i < variants.size(); i++) {
                users.add(new User("user-" + i, variants.get(i)));
            }
            return users;
        }

        @Test
        @DisplayName("should select exactly the rows the evaluator permits for every user and row")
        void shouldAgreeWithEvaluator() {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);

            List<Map<String, List<String>>> rows = rowVariants();
            for (int i = 0; i < rows.size(); i++) {
                sqlStore.insert(TABLE, Map.of("id", "row-" + i, AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN, rows.get(i)));
            }
            Map<String, Object> nullRow = new HashMap<>();
            nullRow.put("id", "sql-null");
            nullRow.put(AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN, null);
            sqlStore.insert(TABLE, nullRow);

            // Shapes only raw writes can produce: JSON null, non-objects, a scalar category value.
            Map<String, String> rawRows = new LinkedHashMap<>();
            rawRows.put("json-null", "null");
            rawRows.put("json-array", "[\"x\"]");
            rawRows.put("json-string", "\"x\"");
            rawRows.put("json-number", "42");
            rawRows.put("scalar-roles", "{\"roles\": \"x\"}");
            rawRows.forEach((id, json) -> jdbcTemplate.update(
                    "INSERT INTO " + TABLE + " (id, access_attributes) VALUES (?, ?)", id, json));

            Map<String, SqlRecord> records = new LinkedHashMap<>();
            for (Map<String, Object> row : sqlStore.fetchAll(TABLE, FetchQuery.all()).data()) {
                records.put(String.valueOf(row.get("id")), SqlRecord.fromRow(TABLE, row));
            }
            assertThat(records).hasSize(rows.size() + 1 + rawRows.size());

            List<AccessRule> policy = AccessPolicies.defaultPolicy();
            List<User> users = new ArrayList<>(userVariants());
            users.add(null);

            for (User user : users) {
                SqlPredicate predicate = builder.build(policy, user);
                Set<Object> selected = new LinkedHashSet<>(ids(sqlStore.fetchAll(TABLE, FetchQuery.builder()
                        .whereSql(predicate.sql())
                        .whereSqlParameters(predicate.parameters())
                        .build())));

                Set<Object> permitted = new LinkedHashSet<>();
                records.forEach((id, record) -> {
                    if (AccessPolicyEngine.isActionAllowed(policy, Action.READ, record, user)) {
                        permitted.add(id);
                    }
                });

                assertThat(selected)
                        .as("rows selected for %s", user)
                        .containsExactlyInAnyOrderElementsOf(permitted);
            }
        }

        @Test
        @DisplayName("should never return a row the evaluator denies")
        void shouldPostFilterEveryRow() {
            List<Map<String, List<String>>> rows = rowVariants();
            for (int i = 0; i < rows.size(); i++) {
                sqlStore.insert(TABLE, Map.of("id", "row-" + i, AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN, rows.get(i)));
            }

            for (User user : userVariants()) {
                for (Map<String, Object> row : store.fetchAll(user, TABLE, FetchQuery.all()).data()) {
                    assertThat(AccessPolicyEngine.isActionAllowed(
                            AccessPolicies.defaultPolicy(), Action.READ, SqlRecord.fromRow(TABLE, row), user))
                            .as("row %s for %s", row.get("id"), user)
                            .isTrue();
                }
            }
        }
    }

    @Nested
    @DisplayName("custom policies")
    class CustomPolicies {

        private final List<AccessRule> auditorPolicy = List.of(
                AccessRule.permit(Scope.of(Set.of(Action.READ)), List.of("user with auditor in roles")));

        @Test
        @DisplayName("should filter rows with the evaluator after a conservative pre-filter")
        void shouldEvaluateCustomPolicy() {
            insert(anAdmin(), "a", 1);
            insert(aViewer(), "b", 2);
            insert(null, "public", 3);
            User auditor = aUser().withAttribute("roles", "auditor").build();

            FetchQuery ordered = FetchQuery.builder().orderBy(List.of(OrderBy.asc("created_at"))).build();

            assertThat(ids(store.fetchAll(auditor, TABLE, auditorPolicy, ordered))).containsExactly("a", "b", "public");
            assertThat(ids(store.fetchAll(anAdmin(), TABLE, auditorPolicy, ordered))).containsExactly("public");
            assertThat(ids(store.fetchAll(null, TABLE, auditorPolicy, ordered))).containsExactly("public");
            assertThat(registry.get("sqlstore.prefilter").tag("mode", "conservative").counter().count()).isEqualTo(3.0);
            assertThat(registry.get("sqlstore.rows.dropped").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("should keep pre-filter order and paging when dropping rows")
        void shouldKeepOrderAndPaging() {
            insert(anAdmin(), "a", 1);
            insert(aViewer(), "b", 2);
            insert(anAdmin(), "c", 3);
            insert(anAdmin(), "d", 4);

            PaginatedResult page = store.fetchAll(anAdmin(), TABLE, auditorPolicy, FetchQuery.builder()
                    .orderBy(List.of(OrderBy.desc("created_at")))
                    .limit(2)
                    .build());

            assertThat(page.data()).isEmpty();
            assertThat(page.hasMore()).isTrue();

            User adminAuditor = aUser().withAttribute("roles", "admin", "auditor").build();
            PaginatedResult visible = store.fetchAll(adminAuditor, TABLE, auditorPolicy, FetchQuery.builder()
                    .orderBy(List.of(OrderBy.desc("created_at")))
                    .limit(3)
                    .build());
            assertThat(ids(visible)).containsExactly("d", "c", "b");
            assertThat(visible.hasMore()).isTrue();
        }
    }

    @Nested
    @DisplayName("snapshots")
    class Snapshots {

        @Test
        @DisplayName("should keep the attributes captured at insert time")
        void shouldNotUpdateRetroactively() {
            Map<String, List<String>> attributes = new HashMap<>();
            attributes.put("roles", new ArrayList<>(List.of("admin")));
            User alice = new User("alice", attributes);
            insert(alice, "a", 1);

            attributes.put("roles", List.of("viewer"));
            User demotedAlice = new User("alice", Map.of("roles", List.of("viewer")));

            assertThat(ids(store.fetchAll(demotedAlice, TABLE, FetchQuery.all()))).isEmpty();
            assertThat(ids(store.fetchAll(anAdmin(), TABLE, FetchQuery.all()))).containsExactly("a");
            assertThat(sqlStore.fetchOne(TABLE, FetchQuery.all()))
                    .containsEntry(AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN, Map.of("roles", List.of("admin")));
        }

        @Test
        @DisplayName("should refuse updates of the access column")
        void shouldRefuseAccessColumnUpdates() {
            insert(anAdmin(), "a", 1);

            assertThatThrownBy(() -> store.update(anAdmin(), TABLE,
                    Map.of(AuthorizedSqlStore.ACCESS_ATTRIBUTES_COLUMN, Map.of()), Map.of("id", "a")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("update and delete")
    class UpdateAndDelete {

        @Test
        @DisplayName("should raise on an empty where clause and write nothing")
        void shouldRequireWhere() {
            insert(anAdmin(), "a", 1);

            assertThatThrownBy(() -> store.update(anAdmin(), TABLE, Map.of("title", "changed"), Map.of()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.delete(anAdmin(), TABLE, Map.of()))
                    .isInstanceOf(IllegalArgumentException.class);

            assertThat(store.fetchOne(anAdmin(), TABLE, FetchQuery.all())).containsEntry("title", "doc a");
        }

        @Test
        @DisplayName("should update rows the user may update")
        void shouldUpdatePermittedRows() {
            insert(anAdmin(), "a", 1);

            assertThat(store.update(anAdmin(), TABLE, Map.of("title", "changed"), Map.of("id", "a"))).isEqualTo(1);
            assertThat(store.fetchOne(anAdmin(), TABLE, FetchQuery.all())).containsEntry("title", "changed");
        }

        @Test
        @DisplayName("should deny updates and deletes of rows the user may not touch")
        void shouldDenyForeignRows() {
            insert(anAdmin(), "a", 1);

            assertThatThrownBy(() -> store.update(aViewer(), TABLE, Map.of("title", "hijacked"), Map.of("id", "a")))
                    .isInstanceOf(AccessDeniedException.class);
            assertThatThrownBy(() -> store.delete(null, TABLE, Map.of("id", "a")))
                    .isInstanceOf(AccessDeniedException.class);

            assertThat(store.fetchOne(anAdmin(), TABLE, FetchQuery.all())).containsEntry("title", "doc a");
        }

        @Test
        @DisplayName("should let anyone delete public rows")
        void shouldDeletePublicRows() {
            insert(null, "p", 1);

            assertThat(store.delete(null, TABLE, Map.of("id", "p"))).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("createTableWithAccessControl")
    class CreateTable {

        @Test
        @DisplayName("should add the access column to an existing table and treat old rows as public")
        void shouldMigrateExistingTable() {
            Map<String, ColumnDefinition> legacySchema = new LinkedHashMap<>();
            legacySchema.put("id", ColumnDefinition.primaryKey(ColumnType.STRING));
            legacySchema.put("title", ColumnDefinition.of(ColumnType.STRING));
            sqlStore.createTable("legacy", legacySchema);
            sqlStore.insert("legacy", Map.of("id", "old", "title", "before migration"));

            store.createTableWithAccessControl("legacy", legacySchema);
            store.createTableWithAccessControl("legacy", legacySchema);
            store.insert(anAdmin(), "legacy", Map.of("id", "new", "title", "after migration"));

            assertThat(ids(store.fetchAll(null, "legacy", FetchQuery.all()))).containsExactly("old");
            assertThat(ids(store.fetchAll(anAdmin(), "legacy", FetchQuery.all()))).containsExactlyInAnyOrder("old", "new");
        }

        @Test
        @DisplayName("should swallow migration errors")
        void shouldSwallowMigrationErrors() {
            SqlStore failing = mock(SqlStore.class);
            when(failing.dialect()).thenReturn(new SqliteDialect());
            doThrow(new BadSqlGrammarException("alter", "ALTER TABLE t ADD COLUMN access_attributes JSON",
                    new SQLException("duplicate column name: access_attributes")))
                    .when(failing).addColumnIfNotExists(anyString(), anyString(), any(), anyBoolean());

            AuthorizedSqlStore authorized = new AuthorizedSqlStore(
                    failing, new AccessControlWhereClauseBuilder(new SqliteDialect(), true), AccessPolicies.defaultPolicy(), null);

            assertThatCode(() -> authorized.createTableWithAccessControl("t", Map.of("id", ColumnDefinition.of(ColumnType.STRING))))
                    .doesNotThrowAnyException();
            verify(failing).createTable(eq("t"), anyMap());
        }
    }
}
