package io.github.yok.csvreconciler.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class ColumnDescriptorTest {

    @Test
    void コンストラクタ_正常ケース_大文字の列名を指定する_小文字で保持されること() {
        ColumnDescriptor column =
                new ColumnDescriptor(" ProductId ", ColumnType.STRING, false, null, true);
        assertEquals("productid", column.getName());
        assertTrue(column.isUnique());
        assertNull(column.getPattern());
    }

    @Test
    void コンストラクタ_異常ケース_列名が空である_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> new ColumnDescriptor(" ", ColumnType.STRING, false, null, false));
        assertThrows(NullPointerException.class,
                () -> new ColumnDescriptor("a", null, false, null, false));
    }

    @Test
    void accepts_正常ケース_null値を指定する_nullable設定に従うこと() {
        assertTrue(new ColumnDescriptor("campaign", ColumnType.STRING, true, null, false)
                .accepts(null));
        assertFalse(new ColumnDescriptor("name", ColumnType.STRING, false, null, false)
                .accepts(null));
    }

    @Test
    void accepts_異常ケース_nullableでも型不一致の値を指定する_拒否されること() {
        ColumnDescriptor column =
                new ColumnDescriptor("quantity", ColumnType.INTEGER, true, null, false);
        assertFalse(column.accepts("ten"));
        assertTrue(column.accepts("10"));
    }

    @Test
    void matchesPattern_正常ケース_パターン指定ありとなしを比較する_結果が期待通りであること() {
        ColumnDescriptor withPattern =
                new ColumnDescriptor("currency", ColumnType.STRING, false, "[A-Z]{3}", false);
        assertTrue(withPattern.matchesPattern("EUR"));
        assertFalse(withPattern.matchesPattern("euro"));
        assertTrue(withPattern.matchesPattern(null));

        ColumnDescriptor withoutPattern =
                new ColumnDescriptor("currency", ColumnType.STRING, false, "", false);
        assertTrue(withoutPattern.matchesPattern("anything"));
    }

    @Test
    void convert_正常ケース_nullと値を指定する_型に応じて変換されること() {
        ColumnDescriptor column =
                new ColumnDescriptor("amount", ColumnType.FLOAT, true, null, false);
        assertNull(column.convert(null));
        assertEquals(Double.valueOf(20.0), column.convert("20.00"));
    }
}
