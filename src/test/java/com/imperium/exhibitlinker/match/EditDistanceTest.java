package com.imperium.exhibitlinker.match;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EditDistanceTest {

    @Test
    void levenshtein_countsSingleCharacterEdits() {
        assertThat(EditDistance.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(EditDistance.levenshtein("deposition", "depositon")).isEqualTo(1);
        assertThat(EditDistance.levenshtein("", "memo")).isEqualTo(4);
        assertThat(EditDistance.levenshtein("memo", "memo")).isZero();
    }

    @Test
    void similarity_isNormalizedByLongerString() {
        assertThat(EditDistance.similarity("1_memo", "1_memo")).isEqualTo(1.0);
        assertThat(EditDistance.similarity("9_invoices", "9_invoicey")).isCloseTo(0.9, within(1e-9));
        assertThat(EditDistance.similarity("abc", "xyz")).isZero();
        assertThat(EditDistance.similarity("", "")).isEqualTo(1.0);
    }
}
