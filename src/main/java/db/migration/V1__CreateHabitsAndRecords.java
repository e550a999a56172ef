package db.migration;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Creates the habits and records tables.
 * Records cascade with their habit and are unique per (habit, date).
 */
public class V1__CreateHabitsAndRecords extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        final JdbcTemplate jdbcTemplate = new JdbcTemplate(
            new SingleConnectionDataSource(context.getConnection(), true)
        );

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS habits (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                name VARCHAR(255) NOT NULL,
                CONSTRAINT uk_habits_name UNIQUE (name)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS records (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                habit_id BIGINT NOT NULL,
                record_date DATE NOT NULL,
                CONSTRAINT fk_records_habit FOREIGN KEY (habit_id)
                    REFERENCES habits (id) ON DELETE CASCADE,
                CONSTRAINT uk_records_habit_date UNIQUE (habit_id, record_date)
            )
        """);
    }
}
