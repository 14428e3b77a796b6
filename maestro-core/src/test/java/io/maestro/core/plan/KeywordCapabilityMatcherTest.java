package io.maestro.core.plan;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeywordCapabilityMatcherTest {

    private KeywordCapabilityMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = KeywordCapabilityMatcher.standard();
    }

    @Test
    void shouldMatchWholeWordsCaseInsensitively() {
        assertThat(matcher.match("Show me all CUSTOMER records", Set.of())).containsExactly("crm");
        assertThat(matcher.match("Ask the accountant", Set.of())).isEmpty();
        assertThat(matcher.match("HR report", Set.of())).containsExactly("hr");
    }

    @Test
    void shouldMatchPluralOfKeyword() {
        assertThat(matcher.match("list open quotes", Set.of())).containsExactly("sales");
        assertThat(matcher.match("send the invoices", Set.of())).containsExactly("accounting");
    }

    @Test
    void shouldOrderCapabilitiesByFirstMention() {
        assertThat(matcher.match("invoice the customer for the order", Set.of()))
                .containsExactly("accounting", "crm", "sales");
    }

    @Test
    void shouldTreatKnownCapabilityNamesAsPhrases() {
        Set<String> known = Set.of("warehouse_operations", "forecast");
        assertThat(matcher.match("run the warehouse operations audit", known))
                .containsExactly("inventory", "warehouse_operations");
        assertThat(matcher.match("forecast demand", known)).containsExactly("forecast");
    }

    @Test
    void shouldAcceptAdditionalKeywords() {
        // Given
        matcher.withKeywords("shipping", "parcel", "delivery");

        // When / Then
        assertThat(matcher.match("send two parcels", Set.of())).containsExactly("shipping");
        assertThat(matcher.keywordsFor("SHIPPING")).containsExactlyInAnyOrder("parcel", "delivery");
    }

    @Test
    void shouldTokenizeOnNonAlphanumerics() {
        assertThat(KeywordCapabilityMatcher.tokenize("Create lead: ACME-42!"))
                .containsExactly("create", "lead", "acme", "42");
    }
}
