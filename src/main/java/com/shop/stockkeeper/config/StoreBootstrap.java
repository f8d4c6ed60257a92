package com.shop.stockkeeper.config;

import com.shop.stockkeeper.exception.StoreException;
import com.shop.stockkeeper.model.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.ResultSetMetaData;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Opens the store and brings it to the current schema. Runs while the
 * application context starts, so the web server never accepts a request
 * against an unprepared store, and any failure aborts startup.
 * <p>
 * Every step is guarded and safe to repeat on each start.
 */
@Component
public class StoreBootstrap implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(StoreBootstrap.class);

    private static final String SCHEMA_SCRIPT = "db/schema.sql";
    private static final int SALE_TOTAL_PRECISION = 24;

    /** Columns each table must expose, matching the mapped entities. */
    static final Map<String, Set<String>> EXPECTED_COLUMNS = new LinkedHashMap<>();

    static {
        EXPECTED_COLUMNS.put("shops", Set.of("id", "name"));
        EXPECTED_COLUMNS.put("users", Set.of("id", "username", "password", "role"));
        EXPECTED_COLUMNS.put("items", Set.of("id", "shop_id", "name", "price", "quantity"));
        EXPECTED_COLUMNS.put("sales", Set.of("id", "shop_id", "item_id", "user_id", "quantity", "total", "created_at"));
        EXPECTED_COLUMNS.put("audit_logs", Set.of("id", "username", "action", "details", "logged_at"));
    }

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final ShopProperties properties;

    public StoreBootstrap(DataSource dataSource, ShopProperties properties) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.properties = properties;
    }

    @Override
    public void afterPropertiesSet() {
        bootstrap();
    }

    public void bootstrap() {
        try {
            createTables();
            Long defaultShopId = ensureDefaultShop();
            migrateLegacyItems(defaultShopId);
            widenSaleTotals();
            ensureAdmin();
        } catch (DataAccessException e) {
            throw new StoreException("Store bootstrap failed: " + e.getMessage(), e);
        }
        verifySchema();
        log.info("Store ready");
    }

    private void createTables() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
        populator.setContinueOnError(false);
        populator.execute(dataSource);
    }

    private Long ensureDefaultShop() {
        Long firstShopId = jdbcTemplate.queryForObject("SELECT MIN(id) FROM shops", Long.class);
        if (firstShopId != null) {
            return firstShopId;
        }
        String name = properties.getBootstrap().getDefaultShopName();
        jdbcTemplate.update("INSERT INTO shops (name) VALUES (?)", name);
        log.info("Created default shop '{}'", name);
        return jdbcTemplate.queryForObject("SELECT MIN(id) FROM shops", Long.class);
    }

    /**
     * Items created before shops existed carry no shop_id; they all belong to
     * the first shop. Each step checks its own outcome, so a start that failed
     * halfway is completed by the next one.
     */
    private void migrateLegacyItems(Long defaultShopId) {
        if (!columnsOf("items").contains("shop_id")) {
            log.warn("items table has no shop_id column, assigning existing items to shop {}", defaultShopId);
            jdbcTemplate.execute("ALTER TABLE items ADD COLUMN shop_id BIGINT");
        }
        int moved = jdbcTemplate.update("UPDATE items SET shop_id = ? WHERE shop_id IS NULL", defaultShopId);
        if (moved > 0) {
            log.info("Moved {} legacy items into shop {}", moved, defaultShopId);
        }
        if (isNullable("items", "shop_id")) {
            jdbcTemplate.execute("ALTER TABLE items ALTER COLUMN shop_id SET NOT NULL");
        }

        Set<String> constraints = constraintsOf("items");
        if (!constraints.contains("fk_items_shop")) {
            jdbcTemplate.execute("ALTER TABLE items ADD CONSTRAINT fk_items_shop FOREIGN KEY (shop_id) REFERENCES shops (id)");
        }
        if (!constraints.contains("ck_items_price")) {
            int clamped = jdbcTemplate.update("UPDATE items SET price = 0 WHERE price < 0");
            if (clamped > 0) {
                log.warn("Reset negative price to 0 on {} legacy items", clamped);
            }
            jdbcTemplate.execute("ALTER TABLE items ADD CONSTRAINT ck_items_price CHECK (price >= 0)");
        }
        if (!constraints.contains("ck_items_quantity")) {
            int clamped = jdbcTemplate.update("UPDATE items SET quantity = 0 WHERE quantity < 0");
            if (clamped > 0) {
                log.warn("Reset negative stock to 0 on {} legacy items", clamped);
            }
            jdbcTemplate.execute("ALTER TABLE items ADD CONSTRAINT ck_items_quantity CHECK (quantity >= 0)");
        }
    }

    private void widenSaleTotals() {
        List<Integer> precision = jdbcTemplate.queryForList(
                "SELECT NUMERIC_PRECISION FROM INFORMATION_SCHEMA.COLUMNS "
                        + "WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND UPPER(TABLE_NAME) = 'SALES' "
                        + "AND UPPER(COLUMN_NAME) = 'TOTAL'",
                Integer.class);
        if (!precision.isEmpty() && precision.get(0) != null && precision.get(0) < SALE_TOTAL_PRECISION) {
            log.info("Widening sales.total from precision {} to {}", precision.get(0), SALE_TOTAL_PRECISION);
            jdbcTemplate.execute("ALTER TABLE sales ALTER COLUMN total SET DATA TYPE DECIMAL("
                    + SALE_TOTAL_PRECISION + ", 2)");
        }
    }

    private boolean isNullable(String table, String column) {
        List<String> nullable = jdbcTemplate.queryForList(
                "SELECT IS_NULLABLE FROM INFORMATION_SCHEMA.COLUMNS "
                        + "WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND UPPER(TABLE_NAME) = ? AND UPPER(COLUMN_NAME) = ?",
                String.class, table.toUpperCase(Locale.ROOT), column.toUpperCase(Locale.ROOT));
        return nullable.isEmpty() || "YES".equalsIgnoreCase(nullable.get(0));
    }

    Set<String> constraintsOf(String table) {
        List<String> names = jdbcTemplate.queryForList(
                "SELECT CONSTRAINT_NAME FROM INFORMATION_SCHEMA.TABLE_CONSTRAINTS "
                        + "WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND UPPER(TABLE_NAME) = ?",
                String.class, table.toUpperCase(Locale.ROOT));
        Set<String> constraints = new TreeSet<>();
        for (String name : names) {
            constraints.add(name.toLowerCase(Locale.ROOT));
        }
        return constraints;
    }

    private void ensureAdmin() {
        Integer admins = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM users WHERE role = ?", Integer.class,
                UserRole.ADMIN.getCode());
        if (admins != null && admins > 0) {
            return;
        }
        ShopProperties.Bootstrap seed = properties.getBootstrap();
        jdbcTemplate.update("INSERT INTO users (username, password, role) VALUES (?, ?, ?)",
                seed.getAdminUsername(), seed.getAdminPassword(), UserRole.ADMIN.getCode());
        log.warn("Created built-in admin '{}' with the placeholder password, change it", seed.getAdminUsername());
    }

    /**
     * Each table must expose exactly the mapped columns; anything missing or
     * unexpected is a schema mismatch.
     */
    void verifySchema() {
        for (Map.Entry<String, Set<String>> entry : EXPECTED_COLUMNS.entrySet()) {
            Set<String> actual;
            try {
                actual = columnsOf(entry.getKey());
            } catch (DataAccessException e) {
                throw new StoreException("Schema mismatch: table " + entry.getKey() + " is not readable", e);
            }
            if (!actual.equals(new TreeSet<>(entry.getValue()))) {
                throw new StoreException("Schema mismatch on table " + entry.getKey() + ": expected "
                        + new TreeSet<>(entry.getValue()) + " but found " + actual);
            }
        }
    }

    private Set<String> columnsOf(String table) {
        ResultSetExtractor<Set<String>> extractor = rs -> {
            ResultSetMetaData metaData = rs.getMetaData();
            Set<String> columns = new TreeSet<>();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                columns.add(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT));
            }
            return columns;
        };
        return jdbcTemplate.query("SELECT * FROM " + table + " WHERE 1 = 0", extractor);
    }
}
