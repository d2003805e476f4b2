package com.drip.rules.store;

import com.drip.rules.store.schema.FieldType;
import com.drip.rules.store.schema.RecordSchema;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Users with orders, shared by the in-memory and SQL store tests.
 *
 * <pre>
 * id | email             | first_name | age  | is_active | date_joined          | orders
 * 1  | ann@example.com   | Ann        | 15   | true      | 2023-12-30T10:00:00Z | 2
 * 2  | bob@example.org   | Bob        | 18   | false     | 2023-06-01T00:00:00Z | 0
 * 3  | cleo@example.com  | cleo       | 21   | true      | 2023-12-31T23:00:00Z | 1
 * 4  | dan@example.net   | Dan        | null | true      | null                 | 0
 * </pre>
 */
public final class UserFixtures {

    public static final RecordSchema ORDERS = RecordSchema.builder("orders")
            .field("user_id", FieldType.INTEGER)
            .field("total", FieldType.DECIMAL)
            .field("status", FieldType.STRING)
            .build();

    public static final RecordSchema USERS = RecordSchema.builder("users")
            .field("email", FieldType.STRING)
            .field("first_name", FieldType.STRING)
            .field("last_name", FieldType.STRING)
            .field("age", FieldType.INTEGER)
            .field("min_age", FieldType.INTEGER)
            .field("is_active", FieldType.BOOLEAN)
            .field("date_joined", FieldType.DATETIME)
            .field("birthday", FieldType.DATE)
            .hasMany("orders", ORDERS, "user_id")
            .build();

    private UserFixtures() {
    }

    public static List<Map<String, Object>> users() {
        return List.of(
                user(1, "ann@example.com", "Ann", "Lee", 15, true, "2023-12-30T10:00:00Z", "2009-03-01",
                        List.of(order(11, 1, "25.00", "paid"), order(12, 1, "5.50", "refunded"))),
                user(2, "bob@example.org", "Bob", "Stone", 18, false, "2023-06-01T00:00:00Z", "2006-01-01",
                        List.of()),
                user(3, "cleo@example.com", "cleo", "Lee", 21, true, "2023-12-31T23:00:00Z", "2002-12-31",
                        List.of(order(13, 3, "100.00", "paid"))),
                user(4, "dan@example.net", "Dan", null, null, true, null, null, List.of()));
    }

    private static Map<String, Object> user(long id, String email, String firstName, String lastName, Integer age,
                                            boolean active, String joined, String birthday,
                                            List<Map<String, Object>> orders) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("email", email);
        row.put("first_name", firstName);
        row.put("last_name", lastName);
        row.put("age", age);
        row.put("min_age", 18);
        row.put("is_active", active);
        row.put("date_joined", joined == null ? null : Instant.parse(joined));
        row.put("birthday", birthday == null ? null : LocalDate.parse(birthday));
        row.put("orders", orders);
        return row;
    }

    private static Map<String, Object> order(long id, long userId, String total, String status) {
        return Map.of("id", id, "user_id", userId, "total", new BigDecimal(total), "status", status);
    }

    /**
     * Creates {@code users} and {@code orders} tables holding {@link #users()}.
     */
    public static void createTables(DataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS orders");
            stmt.execute("DROP TABLE IF EXISTS users");
            stmt.execute("""
                    CREATE TABLE users (
                        id BIGINT PRIMARY KEY,
                        email VARCHAR(255),
                        first_name VARCHAR(100),
                        last_name VARCHAR(100),
                        age BIGINT,
                        min_age BIGINT,
                        is_active BOOLEAN,
                        date_joined TIMESTAMP,
                        birthday DATE
                    )""");
            stmt.execute("""
                    CREATE TABLE orders (
                        id BIGINT PRIMARY KEY,
                        user_id BIGINT REFERENCES users (id),
                        total DECIMAL(10, 2),
                        status VARCHAR(20)
                    )""");
            insertUsers(conn);
        }
    }

    @SuppressWarnings("unchecked")
    private static void insertUsers(Connection conn) throws SQLException {
        try (PreparedStatement user = conn.prepareStatement(
                "INSERT INTO users VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)");
             PreparedStatement order = conn.prepareStatement("INSERT INTO orders VALUES (?, ?, ?, ?)")) {
            for (Map<String, Object> row : users()) {
                user.setObject(1, row.get("id"));
                user.setObject(2, row.get("email"));
                user.setObject(3, row.get("first_name"));
                user.setObject(4, row.get("last_name"));
                user.setObject(5, row.get("age"), Types.BIGINT);
                user.setObject(6, row.get("min_age"), Types.BIGINT);
                user.setObject(7, row.get("is_active"));
                Instant joined = (Instant) row.get("date_joined");
                user.setTimestamp(8, joined == null ? null : Timestamp.from(joined));
                LocalDate birthday = (LocalDate) row.get("birthday");
                user.setDate(9, birthday == null ? null : Date.valueOf(birthday));
                user.executeUpdate();

                for (Map<String, Object> o : (List<Map<String, Object>>) row.get("orders")) {
                    order.setObject(1, o.get("id"));
                    order.setObject(2, o.get("user_id"));
                    order.setBigDecimal(3, (BigDecimal) o.get("total"));
                    order.setString(4, (String) o.get("status"));
                    order.executeUpdate();
                }
            }
        }
    }
}
