package io.github.yok.csvreconciler.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.csvreconciler.schema.ColumnDescriptor;
import io.github.yok.csvreconciler.schema.ColumnType;
import io.github.yok.csvreconciler.schema.TableDescriptor;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

class ReconcileConfigTest {

    private static ReconcileConfig.Column column(String name, String type, boolean nullable) {
        ReconcileConfig.Column column = new ReconcileConfig.Column();
        column.setName(name);
        column.setType(type);
        column.setNullable(nullable);
        return column;
    }

    @Test
    void toTableDescriptors_正常ケース_エンティティ定義を変換する_順序と型が保持されること() {
        ReconcileConfig.Entity entity = new ReconcileConfig.Entity();
        entity.setName("products");
        entity.setFile("inventory.csv");
        entity.setUnique(List.of("productid"));
        entity.setColumns(List.of(column("productid", "string", false),
                column("quantity", "integer", false), column("note", "str", true)));

        ReconcileConfig config = new ReconcileConfig();
        config.setEntities(List.of(entity));

        List<TableDescriptor> descriptors = config.toTableDescriptors();
        assertEquals(1, descriptors.size());
        TableDescriptor descriptor = descriptors.get(0);
        assertEquals("inventory.csv", descriptor.getFile());
        assertEquals(List.of("productid", "quantity", "note"), descriptor.getColumnNames());
        assertEquals(ColumnType.INTEGER, descriptor.getColumn("quantity").get().getType());
        assertTrue(descriptor.getColumn("note").get().isNullable());
        assertFalse(descriptor.getDeclaredPrimaryKey().isPresent());
    }

    @Test
    void toTableDescriptors_異常ケース_未知の型名を指定する_IllegalArgumentExceptionが送出されること() {
        ReconcileConfig.Entity entity = new ReconcileConfig.Entity();
        entity.setName("t");
        entity.setColumns(List.of(column("id", "uuid", false)));
        ReconcileConfig config = new ReconcileConfig();
        config.setEntities(List.of(entity));

        assertThrows(IllegalArgumentException.class, config::toTableDescriptors);
    }

    @Test
    void デフォルト値_正常ケース_新規生成する_待機なしで列型はstringであること() {
        assertEquals(Duration.ZERO, new ReconcileConfig().getStartupDelay());
        assertTrue(new ReconcileConfig().getEntities().isEmpty());
        assertEquals("string", new ReconcileConfig.Column().getType());
    }

    @Test
    void bind_正常ケース_同梱のapplication_ymlを読み込む_productsとordersが定義されていること()
            throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader().load("application",
                new ClassPathResource("application.yml"));
        Binder binder = new Binder(ConfigurationPropertySources.from(sources));
        ReconcileConfig config = binder.bind("reconcile", ReconcileConfig.class).get();

        assertEquals(Duration.ofSeconds(3), config.getStartupDelay());
        List<TableDescriptor> descriptors = config.toTableDescriptors();
        assertEquals(2, descriptors.size());

        TableDescriptor products = descriptors.get(0);
        assertEquals("products", products.getName());
        assertEquals("inventory.csv", products.getFile());
        assertEquals("productid", products.getDeclaredPrimaryKey().get());

        TableDescriptor orders = descriptors.get(1);
        assertEquals("orders.csv", orders.getFile());
        assertTrue(orders.getColumn("campaign").get().isNullable());
        ColumnDescriptor datetime = orders.getColumn("datetime").get();
        assertEquals(ColumnType.TIMESTAMP, datetime.getType());
        assertTrue(datetime.accepts("2024-03-01T10:15:00Z"));
        assertFalse(datetime.accepts("2024-03-01 10:15:00"));
        assertEquals(ColumnType.FLOAT, orders.getColumn("amount").get().getType());
    }
}
