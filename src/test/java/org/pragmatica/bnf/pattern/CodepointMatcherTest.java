package org.pragmatica.bnf.pattern;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodepointMatcherTest {

    @Test
    void builder_overlappingAndAdjacentRanges_areMerged() {
        var matcher = CodepointMatcher.builder()
                                      .addRange('a', 'f')
                                      .addRange('d', 'k')
                                      .addRange('l', 'm')
                                      .add('x')
                                      .build();

        assertThat(matcher.rangeCount()).isEqualTo(2);
        assertThat(matcher.matches('m')).isTrue();
        assertThat(matcher.matches('n')).isFalse();
        assertThat(matcher.matches('x')).isTrue();
    }

    @Test
    void negate_flipsMembership() {
        var digits = CodepointMatcher.range('0', '9');

        assertThat(digits.negate().matches('5')).isFalse();
        assertThat(digits.negate().matches('a')).isTrue();
    }

    @Test
    void any_matchesEverything() {
        assertThat(CodepointMatcher.any().matches(0)).isTrue();
        assertThat(CodepointMatcher.any().matches(Character.MAX_CODE_POINT)).isTrue();
    }

    @Test
    void equals_sameRangesInDifferentOrder_areEqual() {
        var first = CodepointMatcher.builder().add('b').add('a').build();
        var second = CodepointMatcher.range('a', 'b');

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }

    @Test
    void addRange_reversed_isRejected() {
        assertThatThrownBy(() -> CodepointMatcher.builder().addRange('z', 'a'))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
