package io.github.yok.csvreconciler.config;

import io.github.yok.csvreconciler.schema.ColumnDescriptor;
import io.github.yok.csvreconciler.schema.ColumnType;
import io.github.yok.csvreconciler.schema.TableDescriptor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code reconcile} section in {@code application.yml}: the
 * entities to reconcile, in processing order, and their schema declarations.
 *
 * <pre>
 * reconcile:
 *   startup-delay: PT3S
 *   entities:
 *     - name: products
 *       file: inventory.csv
 *       unique: [productid]
 *       columns:
 *         - { name: productid, type: string }
 *         - { name: quantity, type: integer }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "reconcile")
@Data
public class ReconcileConfig {

    /**
     * Wait applied before the first connection is opened (the database container may still be
     * starting).
     */
    private Duration startupDelay = Duration.ZERO;

    /**
     * Entities in processing order.
     */
    private List<Entity> entities = new ArrayList<>();

    /**
     * Converts the bound entity declarations into immutable descriptors.
     *
     * @return descriptors in declaration order
     * @throws IllegalArgumentException if a declaration is invalid
     */
    public List<TableDescriptor> toTableDescriptors() {
        List<TableDescriptor> descriptors = new ArrayList<>();
        for (Entity entity : entities) {
            List<ColumnDescriptor> columns = new ArrayList<>();
            for (Column column : entity.getColumns()) {
                columns.add(new ColumnDescriptor(column.getName(),
                        ColumnType.fromName(column.getType()), column.isNullable(),
                        column.getPattern(), column.isUnique()));
            }
            descriptors.add(new TableDescriptor(entity.getName(), entity.getFile(), columns,
                    entity.getUnique(), entity.getPrimaryKey()));
        }
        return descriptors;
    }

    /**
     * One entity declaration.
     */
    @Data
    public static class Entity {
        // Entity and canonical table name (e.g., "products")
        private String name;
        // CSV file name under data-path; defaults to <name>.csv
        private String file;
        // Primary key column; resolved from database metadata when omitted
        private String primaryKey;
        // Columns forming the uniqueness constraint
        private List<String> unique = new ArrayList<>();
        // Column declarations in order
        private List<Column> columns = new ArrayList<>();
    }

    /**
     * One column declaration.
     */
    @Data
    public static class Column {
        // Column name, matched case-insensitively against the CSV header
        private String name;
        // string / integer / float / timestamp
        private String type = "string";
        // Whether an empty cell is allowed
        private boolean nullable = false;
        // Optional regular expression the value must fully match
        private String pattern;
        // Whether values must be unique within the file
        private boolean unique = false;
    }
}
