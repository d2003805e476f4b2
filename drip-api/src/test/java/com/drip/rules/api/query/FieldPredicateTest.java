package com.drip.rules.api.query;

import com.drip.rules.api.model.LookupType;
import com.drip.rules.api.value.FieldReference;
import com.drip.rules.api.value.ScalarValue;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldPredicateTest {

    @Test
    void lookupKeyJoinsFieldAndLookup() {
        FieldPredicate predicate = new FieldPredicate("num_orders", LookupType.GTE, new ScalarValue("3"));

        assertThat(predicate.lookupKey()).isEqualTo("num_orders__gte");
        assertThat(predicate).hasToString("num_orders__gte=ScalarValue[value=3]");
    }

    @Test
    void customSeparator() {
        FieldPredicate predicate = new FieldPredicate("age", LookupType.LT, new FieldReference("limit"), ".");

        assertThat(predicate.lookupKey()).isEqualTo("age.lt");
        assertThat(predicate.value().isDeferred()).isTrue();
    }

    @Test
    void rejectsMissingParts() {
        assertThatThrownBy(() -> new FieldPredicate(null, LookupType.EXACT, new ScalarValue("1")))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new FieldPredicate("age", LookupType.EXACT, null))
                .isInstanceOf(NullPointerException.class);
    }
}
