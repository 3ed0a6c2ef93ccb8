package com.poc.excelingest.util;

import com.poc.excelingest.exception.InvalidCellReferenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CellAddressTest {

    @Test
    @DisplayName("anchored and plain addresses resolve to the same cell")
    void anchoredAndPlainAreEqual() {
        CellAddress anchored = CellAddress.parse("$AA$1");
        CellAddress plain = CellAddress.parse("AA1");

        assertThat(anchored).isEqualTo(plain);
        assertThat(anchored.getColumn()).isEqualTo("AA");
        assertThat(anchored.getRow()).isEqualTo(1);
        assertThat(anchored.getColumnIndex()).isEqualTo(27);
        assertThat(anchored.toAbsolute()).isEqualTo("$AA$1");
        assertThat(anchored.toString()).isEqualTo("AA1");
    }

    @Test
    @DisplayName("column letters and indexes convert both ways")
    void columnConversionRoundTrips() {
        assertThat(CellAddress.columnToIndex("A")).isEqualTo(1);
        assertThat(CellAddress.columnToIndex("Z")).isEqualTo(26);
        assertThat(CellAddress.columnToIndex("AA")).isEqualTo(27);
        assertThat(CellAddress.columnToIndex("XFD")).isEqualTo(16384);
        for (int index : new int[]{1, 26, 27, 52, 703, 16384}) {
            assertThat(CellAddress.columnToIndex(CellAddress.indexToColumn(index))).isEqualTo(index);
        }
    }

    @Test
    @DisplayName("column ordering is by rank, so Z sorts before AA")
    void columnOrderingIsByRank() {
        List<String> addresses = new ArrayList<>(List.of("AA1", "B1", "Z1", "A1"));
        addresses.sort(CellAddress.comparator(CellAddress.Unit.COLUMN));

        assertThat(addresses).containsExactly("A1", "B1", "Z1", "AA1");
        assertThat(CellAddress.sortKey("$C$15", CellAddress.Unit.ROW)).isEqualTo(15);
    }

    @Test
    @DisplayName("offset moves rows and columns")
    void offsetMovesTheAddress() {
        assertThat(CellAddress.parse("B15").offset(1, 0)).isEqualTo(CellAddress.parse("B16"));
        assertThat(CellAddress.parse("Z3").offset(0, 1).toString()).isEqualTo("AA3");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "15B", "b15", "A0", "A", "XFE1", "AAAA1", "A-1"})
    @DisplayName("malformed addresses are rejected")
    void rejectsMalformedAddresses(String address) {
        assertThat(CellAddress.isValid(address)).isFalse();
        assertThatThrownBy(() -> CellAddress.parse(address))
                .isInstanceOf(InvalidCellReferenceException.class)
                .hasMessageContaining("Invalid cell reference");
    }

    @Test
    @DisplayName("null address is rejected")
    void rejectsNull() {
        assertThatThrownBy(() -> CellAddress.parse(null)).isInstanceOf(InvalidCellReferenceException.class);
    }
}
