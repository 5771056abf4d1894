package com.dataplatform.common.model;

import com.dataplatform.common.exception.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProviderDescriptorTest {

    private static ProviderDescriptor startingAt(String id, double reliability) {
        return ProviderDescriptor.builder(id).supports(DataType.QUOTE).reliabilityScore(reliability).build();
    }

    @Nested
    @DisplayName("recordOutcome(): reliability moving average")
    class RecordOutcome {

        @Test
        @DisplayName("a rate-limit answer costs less reliability than a malformed payload")
        void rateLimitedPenalisedLessThanInvalidResponse() {
            ProviderDescriptor throttled = startingAt("throttled", 0.9);
            ProviderDescriptor broken    = startingAt("broken", 0.9);

            double afterRateLimit = throttled.recordOutcome(ErrorKind.RATE_LIMITED);
            double afterInvalid   = broken.recordOutcome(ErrorKind.INVALID_RESPONSE);

            assertTrue(afterRateLimit < 0.9);
            assertTrue(afterInvalid < afterRateLimit);
            assertEquals(0.89, afterRateLimit, 1e-9);
            assertEquals(0.81, afterInvalid, 1e-9);
        }

        @Test
        @DisplayName("the gap widens over repeated failures of each kind")
        void repeatedFailuresKeepOrdering() {
            ProviderDescriptor throttled = startingAt("throttled", 0.9);
            ProviderDescriptor broken    = startingAt("broken", 0.9);

            for (int i = 0; i < 10; i++) {
                throttled.recordOutcome(ErrorKind.RATE_LIMITED);
                broken.recordOutcome(ErrorKind.INVALID_RESPONSE);
            }

            assertTrue(broken.reliabilityScore() < throttled.reliabilityScore());
            assertTrue(throttled.reliabilityScore() >= 0.8);
        }

        @Test
        @DisplayName("success moves the score towards 1.0 and never past it")
        void successBounded() {
            ProviderDescriptor p = startingAt("p", 0.99);
            for (int i = 0; i < 50; i++) {
                p.recordOutcome(null);
            }
            assertTrue(p.reliabilityScore() > 0.99);
            assertTrue(p.reliabilityScore() <= 1.0);
        }
    }

    @Test
    @DisplayName("monthly budget only applies to commercial providers")
    void budgetOnlyForCommercial() {
        ProviderDescriptor commercial = ProviderDescriptor.builder("c").monthlyBudget(50).build();
        ProviderDescriptor government = ProviderDescriptor.builder("g")
            .category(ProviderCategory.GOVERNMENT).monthlyBudget(50).build();

        assertTrue(commercial.hasMonthlyBudget());
        assertFalse(government.hasMonthlyBudget());
    }
}
