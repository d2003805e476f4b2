package com.drip.rules.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class LookupTypeTest {

    @Test
    @DisplayName("There should be exactly fourteen lookups")
    void fourteenLookups() {
        assertThat(LookupType.values()).hasSize(14);
        assertThat(Arrays.stream(LookupType.values()).map(LookupType::code))
                .containsExactly("exact", "iexact", "contains", "icontains", "regex", "iregex",
                        "gt", "gte", "lt", "lte", "startswith", "istartswith", "endswith", "iendswith");
    }

    @ParameterizedTest
    @EnumSource(LookupType.class)
    @DisplayName("Every lookup should resolve from its own code")
    void resolvesFromCode(LookupType type) {
        assertThat(LookupType.fromCode(type.code())).contains(type);
    }

    @Test
    @DisplayName("Unknown, differently cased or null codes should not resolve")
    void unknownCodes() {
        assertThat(LookupType.fromCode("between")).isEmpty();
        assertThat(LookupType.fromCode("GT")).isEmpty();
        assertThat(LookupType.fromCode(null)).isEmpty();
    }

    @Test
    @DisplayName("Case-insensitive variants should share the kind of their sensitive twin")
    void caseInsensitiveVariants() {
        assertThat(LookupType.ICONTAINS.isCaseInsensitive()).isTrue();
        assertThat(LookupType.CONTAINS.isCaseInsensitive()).isFalse();
        assertThat(LookupType.IREGEX.kind()).isEqualTo(LookupType.REGEX.kind());
        assertThat(LookupType.GTE.isOrdering()).isTrue();
        assertThat(LookupType.IENDSWITH.isTextual()).isTrue();
        assertThat(LookupType.EXACT.isTextual()).isFalse();
    }
}
