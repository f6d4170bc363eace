package com.inp2ops.core.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DataRecord}.
 */
class DataRecordTest {

    @Test
    void split_trailingEmptyFields_areDropped() {
        DataRecord record = DataRecord.split(" 1 , 2.5 ,, ", 8, "NODE");

        assertThat(record.fields()).containsExactly("1", "2.5");
        assertThat(record.size()).isEqualTo(2);
    }

    @Test
    void split_separatorOnlyLine_isEmpty() {
        assertThat(DataRecord.split(",", 1, "SOLID SECTION").isEmpty()).isTrue();
    }

    @Test
    void doubleFieldOr_missingField_returnsFallback() throws ParseException {
        DataRecord record = DataRecord.split("1, 2.0", 1, "NODE");

        assertThat(record.doubleFieldOr(3, -1.0)).isEqualTo(-1.0);
    }

    @Test
    void doubleField_nonFiniteValue_fails() {
        DataRecord record = DataRecord.split("1, NaN", 5, "NODE");

        assertThatThrownBy(() -> record.doubleField(1))
            .isInstanceOfSatisfying(ParseException.class, e -> {
                assertThat(e.getLine()).isEqualTo(5);
                assertThat(e.getFieldIndex()).isEqualTo(1);
            });
    }

    @Test
    void idField_nonPositive_fails() {
        DataRecord record = DataRecord.split("0, 1.0", 2, "NODE");

        assertThatThrownBy(() -> record.idField(0))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("ids must be positive");
    }
}
